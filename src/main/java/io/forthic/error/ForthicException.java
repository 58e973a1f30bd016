package io.forthic.error;

import io.forthic.token.CodeLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ForthicException extends RuntimeException {
    static final int MAX_FORTHIC_FRAMES = 64;

    private final List<String> forthicFrames = new ArrayList<>();
    private int omittedFrames;
    private String forthic;
    private CodeLocation location;

    public ForthicException(String message) {
        this(message, null, null, null);
    }

    public ForthicException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ForthicException(String message, String forthic, CodeLocation location) {
        this(message, forthic, location, null);
    }

    public ForthicException(String message, String forthic, CodeLocation location, Throwable cause) {
        super(message, cause);
        this.forthic = forthic;
        this.location = location;
    }

    public String errorType() {
        return "ForthicError";
    }

    public String moduleName() {
        return null;
    }

    public Map<String, String> context() {
        return Map.of();
    }

    public String forthic() {
        return forthic;
    }

    public CodeLocation location() {
        return location;
    }

    /**
     * Records where the failure surfaced unless a more precise location is already known.
     */
    public ForthicException attachLocation(String source, CodeLocation tokenLocation) {
        if (location == null && tokenLocation != null) {
            this.forthic = source;
            this.location = tokenLocation;
        }
        return this;
    }

    /**
     * Appends a call frame. Past {@value #MAX_FORTHIC_FRAMES} frames only a count is kept.
     */
    public void addFrame(String frame) {
        if (forthicFrames.size() < MAX_FORTHIC_FRAMES) {
            forthicFrames.add(frame);
        } else {
            omittedFrames++;
        }
    }

    public List<String> forthicFrames() {
        if (omittedFrames == 0) {
            return Collections.unmodifiableList(forthicFrames);
        }
        List<String> frames = new ArrayList<>(forthicFrames);
        frames.add("... " + omittedFrames + " more frame(s)");
        return Collections.unmodifiableList(frames);
    }
}

package io.forthic.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ErrorInfo(
        String message,
        String runtime,
        List<String> stackTrace,
        String errorType,
        String wordLocation,
        String moduleName,
        Map<String, String> context
) {
    public static final String RUNTIME = "java";
    private static final int MAX_JAVA_FRAMES = 20;

    public ErrorInfo {
        message = message == null ? "" : message;
        runtime = runtime == null || runtime.isBlank() ? RUNTIME : runtime;
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
        errorType = errorType == null ? "" : errorType;
        wordLocation = wordLocation == null ? "" : wordLocation;
        moduleName = moduleName == null ? "" : moduleName;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ErrorInfo of(String errorType, String message) {
        return new ErrorInfo(message, RUNTIME, List.of(), errorType, "", "", Map.of());
    }

    public static ErrorInfo fromException(Throwable error, Map<String, String> extraContext) {
        List<String> frames = new ArrayList<>();
        Map<String, String> context = new LinkedHashMap<>();
        String errorType = error.getClass().getSimpleName();
        String wordLocation = "";
        String moduleName = "";
        if (error instanceof ForthicException) {
            ForthicException forthicError = (ForthicException) error;
            errorType = forthicError.errorType();
            frames.addAll(forthicError.forthicFrames());
            if (forthicError.location() != null) {
                wordLocation = forthicError.location().describe();
            }
            if (forthicError.moduleName() != null) {
                moduleName = forthicError.moduleName();
            }
            context.putAll(forthicError.context());
        }
        StackTraceElement[] javaFrames = error.getStackTrace();
        for (int i = 0; i < javaFrames.length && i < MAX_JAVA_FRAMES; i++) {
            frames.add("at " + javaFrames[i]);
        }
        if (extraContext != null) {
            context.putAll(extraContext);
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ErrorInfo(message, RUNTIME, frames, errorType, wordLocation, moduleName, context);
    }
}

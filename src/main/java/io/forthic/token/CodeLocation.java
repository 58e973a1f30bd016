package io.forthic.token;

/**
 * Position of a token in Forthic source. Lines and columns are 1-based; offsets are
 * 0-based character positions, shifted by the reference location when the source is
 * a fragment of a larger text (module code, interpreted strings).
 */
public record CodeLocation(String source, int line, int column, int startPos, int endPos) {
    public static final CodeLocation START = new CodeLocation(null, 1, 1, 0, 0);

    public static CodeLocation of(String source) {
        return new CodeLocation(source, 1, 1, 0, 0);
    }

    public String describe() {
        String prefix = source == null || source.isBlank() ? "" : source + ":";
        return prefix + line + ":" + column;
    }
}

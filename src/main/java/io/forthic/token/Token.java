package io.forthic.token;

public record Token(TokenType type, String text, CodeLocation location) {
    public boolean isEos() {
        return type == TokenType.EOS;
    }

    /**
     * Equality on kind and text only; locations differ between renderings of the same
     * token sequence.
     */
    public boolean sameAs(Token other) {
        return other != null && type == other.type && text.equals(other.text);
    }
}

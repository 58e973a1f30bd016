package io.forthic.error;

import java.util.Map;

public class RecursionDepthException extends ForthicException {
    private final String word;

    public RecursionDepthException(String word, int limit) {
        super("Maximum definition depth of " + limit + " exceeded in " + word);
        this.word = word;
    }

    public RecursionDepthException(String word, StackOverflowError cause) {
        super("Call stack exhausted while running " + word, cause);
        this.word = word;
    }

    @Override
    public String errorType() {
        return "RecursionError";
    }

    @Override
    public Map<String, String> context() {
        return Map.of("word_name", word);
    }
}

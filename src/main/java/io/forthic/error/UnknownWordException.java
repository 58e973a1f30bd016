package io.forthic.error;

import io.forthic.token.CodeLocation;

import java.util.List;
import java.util.Map;

public class UnknownWordException extends ForthicException {
    private final String word;
    private final List<String> searched;

    public UnknownWordException(String word, List<String> searched, String forthic, CodeLocation location) {
        super(describe(word, searched), forthic, location);
        this.word = word;
        this.searched = searched == null ? List.of() : List.copyOf(searched);
    }

    private static String describe(String word, List<String> searched) {
        if (searched == null || searched.isEmpty()) {
            return "Unknown word: " + word;
        }
        return "Unknown word: " + word + " (searched: " + String.join(", ", searched) + ")";
    }

    public String word() {
        return word;
    }

    public List<String> searched() {
        return searched;
    }

    @Override
    public String errorType() {
        return "UnknownWordError";
    }

    @Override
    public Map<String, String> context() {
        return Map.of("word_name", word);
    }
}

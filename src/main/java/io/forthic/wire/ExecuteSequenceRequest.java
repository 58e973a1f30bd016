package io.forthic.wire;

import io.forthic.model.RuntimeValue;

import java.util.List;

public record ExecuteSequenceRequest(List<String> wordNames, List<RuntimeValue> stack) {
    public ExecuteSequenceRequest {
        if (wordNames == null || wordNames.isEmpty()) {
            throw new IllegalArgumentException("word_names must contain at least one word");
        }
        wordNames = List.copyOf(wordNames);
        stack = stack == null ? List.of() : List.copyOf(stack);
    }
}

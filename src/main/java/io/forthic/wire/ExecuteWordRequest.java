package io.forthic.wire;

import io.forthic.model.RuntimeValue;

import java.util.List;

public record ExecuteWordRequest(String wordName, List<RuntimeValue> stack) {
    public ExecuteWordRequest {
        if (wordName == null || wordName.isEmpty()) {
            throw new IllegalArgumentException("word_name is required");
        }
        stack = stack == null ? List.of() : List.copyOf(stack);
    }
}

package io.forthic.wire;

import io.forthic.error.ErrorInfo;
import io.forthic.model.RuntimeValue;

import java.util.List;

public record ExecutionResponse(List<RuntimeValue> resultStack, ErrorInfo error) {
    public ExecutionResponse {
        resultStack = resultStack == null ? List.of() : List.copyOf(resultStack);
    }

    public static ExecutionResponse ok(List<RuntimeValue> resultStack) {
        return new ExecutionResponse(resultStack, null);
    }

    public static ExecutionResponse fail(ErrorInfo error) {
        return new ExecutionResponse(List.of(), error);
    }

    public boolean isError() {
        return error != null;
    }
}

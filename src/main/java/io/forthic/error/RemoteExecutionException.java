package io.forthic.error;

import java.util.Map;

public class RemoteExecutionException extends ForthicException {
    private final ErrorInfo errorInfo;

    public RemoteExecutionException(String message, ErrorInfo errorInfo) {
        this(message, errorInfo, null);
    }

    public RemoteExecutionException(String message, ErrorInfo errorInfo, Throwable cause) {
        super(message, cause);
        this.errorInfo = errorInfo;
    }

    /**
     * Builds the local exception for an error reported by a remote runtime.
     */
    public static RemoteExecutionException fromErrorInfo(ErrorInfo info) {
        StringBuilder message = new StringBuilder("Error in " + info.runtime() + " runtime: " + info.message());
        if (!info.moduleName().isEmpty()) {
            message.append("\n  Module: ").append(info.moduleName());
        }
        if (!info.wordLocation().isEmpty()) {
            message.append("\n  Location: ").append(info.wordLocation());
        }
        if (!info.context().isEmpty()) {
            message.append("\n  Context:");
            info.context().forEach((key, value) -> message.append("\n    ").append(key).append(": ").append(value));
        }
        return new RemoteExecutionException(message.toString(), info);
    }

    public ErrorInfo errorInfo() {
        return errorInfo;
    }

    public String remoteErrorType() {
        return errorInfo == null ? "" : errorInfo.errorType();
    }

    @Override
    public String moduleName() {
        return errorInfo == null ? null : errorInfo.moduleName();
    }

    @Override
    public String errorType() {
        return "RemoteExecutionError";
    }

    @Override
    public Map<String, String> context() {
        return errorInfo == null ? Map.of() : errorInfo.context();
    }
}

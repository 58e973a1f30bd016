package io.forthic.error;

import java.util.Map;

public class NativeWordException extends ForthicException {
    private final String wordName;
    private final String moduleName;

    public NativeWordException(String wordName, String moduleName, Throwable cause) {
        super("Error in native word " + qualified(wordName, moduleName) + ": " + causeMessage(cause), cause);
        this.wordName = wordName;
        this.moduleName = moduleName;
    }

    private static String qualified(String wordName, String moduleName) {
        return moduleName == null || moduleName.isEmpty() ? wordName : moduleName + "." + wordName;
    }

    private static String causeMessage(Throwable cause) {
        if (cause == null) {
            return "unknown failure";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    public String wordName() {
        return wordName;
    }

    @Override
    public String moduleName() {
        return moduleName;
    }

    @Override
    public String errorType() {
        return "NativeWordError";
    }

    @Override
    public Map<String, String> context() {
        return Map.of("word_name", wordName);
    }
}

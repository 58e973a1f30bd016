package io.forthic.module;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record StackEffect(String text, int inputCount, boolean hasOptions) {
    private static final Pattern SHAPE = Pattern.compile("^\\(\\s*(.*?)\\s*--(.*)\\)$", Pattern.DOTALL);

    public static StackEffect parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("stack effect must not be null");
        }
        String trimmed = text.trim();
        Matcher matcher = SHAPE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("malformed stack effect '" + text + "', expected '( inputs -- outputs )'");
        }
        String inputs = matcher.group(1).trim();
        int count = 0;
        boolean options = false;
        if (!inputs.isEmpty()) {
            for (String input : inputs.split("\\s+")) {
                if (input.startsWith("[") && input.endsWith("]")) {
                    options = true;
                } else {
                    count++;
                }
            }
        }
        return new StackEffect(trimmed, count, options);
    }
}

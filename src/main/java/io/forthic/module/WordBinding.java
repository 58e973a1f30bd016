package io.forthic.module;

public record WordBinding(String name, StackEffect stackEffect, String description, NativeImpl impl) {
    public WordBinding {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("word name must not be empty");
        }
        if (impl == null) {
            throw new IllegalArgumentException("word '" + name + "' has no implementation");
        }
        description = description == null ? "" : description;
    }

    public static WordBinding of(String name, String stackEffect, String description, NativeImpl impl) {
        return new WordBinding(name, StackEffect.parse(stackEffect), description, impl);
    }

    public NativeWord toWord() {
        return new NativeWord(this);
    }
}

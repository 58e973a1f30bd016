package io.forthic.module;

import io.forthic.error.OptionsException;
import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class WordOptions {
    public static final WordOptions EMPTY = new WordOptions(Map.of());

    private final Map<String, RuntimeValue> values;

    private WordOptions(Map<String, RuntimeValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static WordOptions fromFlatArray(List<RuntimeValue> items) {
        if (items.size() % 2 != 0) {
            throw new OptionsException("Options must be key-value pairs, got an odd number of items (" + items.size() + ")");
        }
        Map<String, RuntimeValue> values = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i += 2) {
            RuntimeValue key = items.get(i);
            if (key.kind() != RuntimeValue.Kind.STRING) {
                throw new OptionsException("Option key at position " + i + " must be a string, got " + key.kind().label());
            }
            values.put(((RuntimeValue.StringValue) key).value(), items.get(i + 1));
        }
        return new WordOptions(values);
    }

    public static WordOptions of(Map<String, RuntimeValue> values) {
        return new WordOptions(values);
    }

    public RuntimeValue get(String key) {
        return values.get(key);
    }

    public RuntimeValue get(String key, RuntimeValue defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public String getString(String key, String defaultValue) {
        RuntimeValue value = values.get(key);
        if (value == null || RuntimeValues.isNull(value)) {
            return defaultValue;
        }
        return RuntimeValues.display(value, " ");
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, RuntimeValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof WordOptions && values.equals(((WordOptions) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("<WordOptions:");
        for (Map.Entry<String, RuntimeValue> entry : values.entrySet()) {
            out.append(" .").append(entry.getKey()).append(' ').append(RuntimeValues.describe(entry.getValue()));
        }
        return out.append('>').toString();
    }
}

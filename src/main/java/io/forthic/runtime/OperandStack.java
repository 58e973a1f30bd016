package io.forthic.runtime;

import io.forthic.model.RuntimeValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class OperandStack {
    private final List<RuntimeValue> items = new ArrayList<>();

    public void push(RuntimeValue value) {
        items.add(Objects.requireNonNull(value, "stack values must not be null"));
    }

    public void pushAll(Collection<RuntimeValue> values) {
        for (RuntimeValue value : values) {
            push(value);
        }
    }

    public RuntimeValue pop() {
        return items.remove(items.size() - 1);
    }

    public RuntimeValue peek() {
        return items.get(items.size() - 1);
    }

    /**
     * Removes every item at or above {@code index} and returns them bottom to top.
     */
    public List<RuntimeValue> popFrom(int index) {
        int from = Math.max(0, Math.min(index, items.size()));
        List<RuntimeValue> tail = new ArrayList<>(items.subList(from, items.size()));
        items.subList(from, items.size()).clear();
        return tail;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<RuntimeValue> items() {
        return List.copyOf(items);
    }

    public void clear() {
        items.clear();
    }
}

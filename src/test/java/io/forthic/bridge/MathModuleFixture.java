package io.forthic.bridge;

import io.forthic.model.RuntimeValue;
import io.forthic.module.Module;
import io.forthic.module.ModuleRegistry;
import io.forthic.runtime.CoreModule;

final class MathModuleFixture {
    static final int WORD_COUNT = 30;

    private MathModuleFixture() {
    }

    /**
     * A frozen registry holding {@code core} and a {@code math} module of {@link #WORD_COUNT} words.
     */
    static ModuleRegistry registry() {
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(new CoreModule());
        registry.register(mathModule());
        registry.freeze();
        return registry;
    }

    static Module mathModule() {
        Module math = new Module("math", "Integer arithmetic");
        math.addNativeWord("+", "( a:int b:int -- sum:int )", "Adds two integers",
                (inputs, options) -> RuntimeValue.ofInt(asLong(inputs.get(0)) + asLong(inputs.get(1))));
        math.addNativeWord("-", "( a:int b:int -- diff:int )", "Subtracts b from a",
                (inputs, options) -> RuntimeValue.ofInt(asLong(inputs.get(0)) - asLong(inputs.get(1))));
        math.addNativeWord("SLEEP", "( ms:int -- )", "Blocks for a while", (inputs, options) -> {
            Thread.sleep(asLong(inputs.get(0)));
            return null;
        });
        for (int i = math.words().size(); i < WORD_COUNT; i++) {
            long constant = i;
            math.addNativeWord("CONST-" + i, "( -- n:int )", "Pushes " + i,
                    (inputs, options) -> RuntimeValue.ofInt(constant));
        }
        return math;
    }

    private static long asLong(RuntimeValue value) {
        if (value.kind() != RuntimeValue.Kind.INT) {
            throw new IllegalArgumentException("expected int, got " + value.kind().label());
        }
        return ((RuntimeValue.IntValue) value).value();
    }
}

package io.forthic.runtime;

import io.forthic.error.IntentionalStopException;
import io.forthic.error.OptionsException;
import io.forthic.model.RuntimeValue;
import io.forthic.module.ModuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModuleTest {
    private ByteArrayOutputStream output;
    private Interpreter interp;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(new CoreModule(new PrintStream(output, true, StandardCharsets.UTF_8)));
        interp = new StandardInterpreter(registry, ZoneOffset.UTC);
    }

    @Test
    void stackWordsShouldShuffleValues() {
        interp.run("1 2 SWAP DUP 9 POP");
        assertEquals(List.of(RuntimeValue.ofInt(2), RuntimeValue.ofInt(1), RuntimeValue.ofInt(1)), interp.stackItems());
    }

    @Test
    void interpolateShouldSubstituteVariables() {
        interp.run("'World' 'name' ! 'Hello .name, price\\. 5' INTERPOLATE");
        assertEquals(RuntimeValue.ofString("Hello World, price. 5"), interp.pop());
    }

    @Test
    void printShouldHonorOptions() {
        interp.run("[1 2 3] [.separator ' | '] ~> PRINT");
        interp.run("NULL [.null_text 'none'] ~> PRINT");
        interp.run("[1 'a'] [.json TRUE] ~> PRINT");
        interp.run("'x' 'v' ! 'v is .v' PRINT");
        String[] lines = printed().split("\\R");
        assertEquals("1 | 2 | 3", lines[0]);
        assertEquals("none", lines[1]);
        assertEquals("[1,\"a\"]", lines[2]);
        assertEquals("v is x", lines[3]);
    }

    @Test
    void optionsShouldRejectMalformedPairs() {
        assertThrows(OptionsException.class, () -> interp.run("[.a] ~>"));
        interp.reset();
        OptionsException error = assertThrows(OptionsException.class, () -> interp.run("[1 2] ~>"));
        assertEquals("OptionsError", error.errorType());
    }

    @Test
    void defaultWordsShouldReplaceMissingValues() {
        interp.run("NULL 5 DEFAULT '' 6 DEFAULT 'x' 7 DEFAULT NULL '8' *DEFAULT");
        assertEquals(List.of(RuntimeValue.ofInt(5), RuntimeValue.ofInt(6), RuntimeValue.ofString("x"), RuntimeValue.ofInt(8)),
                interp.stackItems());
    }

    @Test
    void interpretShouldRunNestedCode() {
        interp.run("'1 [2 3] ARRAY?' INTERPRET 4 ARRAY?");
        assertEquals(List.of(RuntimeValue.ofInt(1), RuntimeValue.ofBool(true), RuntimeValue.ofBool(false)),
                interp.stackItems());
    }

    @Test
    void debugWordsShouldPrintAndStop() {
        assertThrows(IntentionalStopException.class, () -> interp.run("PEEK!"));
        assertTrue(printed().contains("<STACK EMPTY>"));
        assertThrows(IntentionalStopException.class, () -> interp.run("1 2 STACK!"));
        assertTrue(printed().contains("2"));
    }

    @Test
    void profileDataShouldCountWordsAndTimestamps() {
        interp.run("PROFILE-START 1 DUP POP POP 'mark' PROFILE-TIMESTAMP PROFILE-END PROFILE-DATA");
        RuntimeValue.RecordValue data = (RuntimeValue.RecordValue) interp.pop();
        RuntimeValue.ArrayValue counts = (RuntimeValue.ArrayValue) data.get("word_counts");
        RuntimeValue.RecordValue top = (RuntimeValue.RecordValue) counts.get(0);
        assertEquals(RuntimeValue.ofString("core.POP"), top.get("word"));
        assertEquals(RuntimeValue.ofInt(2), top.get("count"));

        RuntimeValue.ArrayValue stamps = (RuntimeValue.ArrayValue) data.get("timestamps");
        assertEquals(1, stamps.size());
        RuntimeValue.RecordValue stamp = (RuntimeValue.RecordValue) stamps.get(0);
        assertEquals(RuntimeValue.ofString("mark"), stamp.get("label"));
        assertEquals(RuntimeValue.ofInt(0), stamp.get("delta"));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}

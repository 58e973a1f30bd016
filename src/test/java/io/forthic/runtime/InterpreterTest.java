package io.forthic.runtime;

import io.forthic.error.ExtraSemicolonException;
import io.forthic.error.ForthicException;
import io.forthic.error.InvalidVariableNameException;
import io.forthic.error.MissingSemicolonException;
import io.forthic.error.NativeWordException;
import io.forthic.error.RecursionDepthException;
import io.forthic.error.StackUnderflowException;
import io.forthic.error.TooManyAttemptsException;
import io.forthic.error.UnknownWordException;
import io.forthic.model.RuntimeValue;
import io.forthic.module.Module;
import io.forthic.module.ModuleRegistry;
import io.forthic.module.NativeWord;
import io.forthic.token.CodeLocation;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterpreterTest {
    @Test
    void latestImportShouldWinWhenNamesCollide() {
        Interpreter interp = new StandardInterpreter();
        for (String name : List.of("A", "B", "C")) {
            Module module = new Module(name);
            module.addNativeWord("WHO", "( -- name:str )", "", (inputs, options) -> RuntimeValue.ofString(name));
            interp.importModule(module, "");
        }
        interp.run("WHO");
        assertEquals(List.of(RuntimeValue.ofString("C")), interp.stackItems());

        interp.run(": WHO 'app' ; WHO");
        assertEquals(RuntimeValue.ofString("app"), interp.pop());
    }

    @Test
    void nativeInputsShouldArriveInPushOrder() {
        Interpreter interp = new StandardInterpreter();
        Module module = new Module("pairs");
        module.addNativeWord("PAIR", "( a:int b:int -- rec:record )", "Builds {a, b}", (inputs, options) -> {
            Map<String, RuntimeValue> fields = new LinkedHashMap<>();
            fields.put("a", inputs.get(0));
            fields.put("b", inputs.get(1));
            return RuntimeValue.record(fields);
        });
        interp.importModule(module, "");

        interp.run("10 20 PAIR");
        RuntimeValue.RecordValue record = (RuntimeValue.RecordValue) interp.pop();
        assertEquals(RuntimeValue.ofInt(10), record.get("a"));
        assertEquals(RuntimeValue.ofInt(20), record.get("b"));
    }

    @Test
    void memoShouldComputeOnce() {
        Interpreter interp = new StandardInterpreter();
        interp.run("@: ANSWER 42 ;");
        interp.profileLog().start();
        interp.run("ANSWER ANSWER ANSWER");
        interp.profileLog().stop();

        assertEquals(List.of(new ProfileLog.WordCount("ANSWER", 1)), interp.profileLog().wordHistogram());
        RuntimeValue answer = RuntimeValue.ofInt(42);
        assertEquals(List.of(answer, answer, answer), interp.stackItems());
    }

    @Test
    void memoRefreshWordsShouldRecompute() {
        Interpreter interp = new StandardInterpreter();
        interp.run("5 'x' ! @: X x @ ; X 6 'x' ! X X!@");
        assertEquals(List.of(RuntimeValue.ofInt(5), RuntimeValue.ofInt(5), RuntimeValue.ofInt(6)), interp.stackItems());
        interp.run("X! X");
        assertEquals(RuntimeValue.ofInt(6), interp.pop());
    }

    @Test
    void definitionsShouldResolveWordsWhenCalled() {
        Interpreter interp = new StandardInterpreter();
        interp.run(": A B ; : B 1 ; A");
        assertEquals(RuntimeValue.ofInt(1), interp.pop());
        interp.run(": B 2 ; A");
        assertEquals(RuntimeValue.ofInt(2), interp.pop());
    }

    @Test
    void onlyExportedWordsShouldBeVisibleThroughImports() {
        Interpreter interp = new StandardInterpreter();
        interp.run("{lib : HELPER 7 ; : PUB HELPER DUP ; ['PUB'] EXPORT } ['lib'] USE-MODULES PUB");
        assertEquals(List.of(RuntimeValue.ofInt(7), RuntimeValue.ofInt(7)), interp.stackItems());

        assertThrows(UnknownWordException.class, () -> interp.run("HELPER"));

        interp.run("[['lib' 'l']] USE-MODULES l.PUB");
        assertEquals(4, interp.stackSize());
    }

    @Test
    void moduleBlocksShouldReopenAndRestoreTheModuleStack() {
        Interpreter interp = new StandardInterpreter();
        interp.run("{util : TWO 2 ; } {util TWO }");
        assertEquals(List.of(RuntimeValue.ofInt(2)), interp.stackItems());
        assertEquals(1, interp.moduleStack().size());

        assertThrows(UnknownWordException.class, () -> interp.run("{util NOPE }"));
        assertEquals(1, interp.moduleStack().size());
    }

    @Test
    void unknownWordShouldReportLocationAndScope() {
        Interpreter interp = new StandardInterpreter();
        UnknownWordException error = assertThrows(UnknownWordException.class,
                () -> interp.run("1 NOPE", CodeLocation.of("script")));
        assertEquals("NOPE", error.word());
        assertEquals("script:1:3", error.location().describe());
        assertTrue(error.searched().contains("<app>"));
        assertTrue(error.searched().contains("core"));
        assertEquals(List.of(RuntimeValue.ofInt(1)), interp.stackItems());
        assertTrue(interp.lastError().isPresent());
    }

    @Test
    void failuresInsideDefinitionsShouldRecordCallFrames() {
        Interpreter interp = new StandardInterpreter();
        UnknownWordException error = assertThrows(UnknownWordException.class,
                () -> interp.run(": INNER NOPE ; : OUTER INNER ; OUTER"));
        assertEquals(2, error.forthicFrames().size());
        assertTrue(error.forthicFrames().get(0).startsWith("in INNER at 1:3"));
        assertTrue(error.forthicFrames().get(1).startsWith("in OUTER"));
        assertEquals("UnknownWordError", error.errorType());
    }

    @Test
    void definitionDepthLimitShouldStopDeepCalls() {
        Interpreter interp = new StandardInterpreter();
        interp.setMaxDefinitionDepth(2);
        interp.run(": D3 1 ; : D2 D3 ; : D1 D2 ;");
        interp.run("D2");
        assertEquals(List.of(RuntimeValue.ofInt(1)), interp.stackItems());

        RecursionDepthException error = assertThrows(RecursionDepthException.class, () -> interp.run("D1"));
        assertEquals("RecursionError", error.errorType());
        assertEquals(List.of("in D2", "in D1"), error.forthicFrames().stream()
                .map(frame -> frame.substring(0, frame.indexOf(" at ")))
                .toList());

        interp.run("D2");
        assertEquals(List.of(RuntimeValue.ofInt(1), RuntimeValue.ofInt(1)), interp.stackItems());
    }

    @Test
    void unboundedRecursionShouldFailWithTrimmedFrames() {
        Interpreter interp = new StandardInterpreter();
        RecursionDepthException error = assertThrows(RecursionDepthException.class,
                () -> interp.run(": LOOP LOOP ; LOOP"));
        List<String> frames = error.forthicFrames();
        assertEquals(65, frames.size());
        assertEquals("... " + (Interpreter.DEFAULT_MAX_DEFINITION_DEPTH - 64) + " more frame(s)", frames.get(64));
    }

    @Test
    void definitionSyntaxErrorsShouldBeDetected() {
        Interpreter interp = new StandardInterpreter();
        assertThrows(MissingSemicolonException.class, () -> interp.run(": A 1"));
        assertThrows(MissingSemicolonException.class, () -> interp.run(": A : B ;"));
        assertThrows(ExtraSemicolonException.class, () -> interp.run("1 ;"));
    }

    @Test
    void stackUnderflowShouldBeReported() {
        Interpreter interp = new StandardInterpreter();
        assertThrows(StackUnderflowException.class, () -> interp.run("POP"));
        assertThrows(StackUnderflowException.class, () -> interp.run("SWAP"));
    }

    @Test
    void arraysShouldCollectNestedValues() {
        Interpreter interp = new StandardInterpreter();
        interp.run("[1 [2 'three'] []]");
        RuntimeValue expected = RuntimeValue.array(
                RuntimeValue.ofInt(1),
                RuntimeValue.array(RuntimeValue.ofInt(2), RuntimeValue.ofString("three")),
                RuntimeValue.array());
        assertEquals(List.of(expected), interp.stackItems());
    }

    @Test
    void literalsShouldParseToTypedValues() {
        Interpreter interp = new Interpreter(new ModuleRegistry(), ZoneOffset.UTC);
        interp.run("TRUE -7 3.5 2025-05-24 2025-05-24T10:15:00Z 2025-05-24T10:15:00");
        List<RuntimeValue> stack = interp.stackItems();
        assertEquals(RuntimeValue.ofBool(true), stack.get(0));
        assertEquals(RuntimeValue.ofInt(-7), stack.get(1));
        assertEquals(RuntimeValue.ofFloat(3.5), stack.get(2));
        assertEquals(new RuntimeValue.PlainDateValue("2025-05-24"), stack.get(3));
        assertEquals(RuntimeValue.Kind.INSTANT, stack.get(4).kind());
        assertEquals(RuntimeValue.Kind.ZONED_DATETIME, stack.get(5).kind());
        assertThrows(UnknownWordException.class, () -> interp.run("007"));
    }

    @Test
    void variablesShouldBeDeclaredInTheCurrentModule() {
        Interpreter interp = new StandardInterpreter();
        interp.run("['a' 'b'] VARIABLES 3 a ! a @ 4 b !@");
        assertEquals(List.of(RuntimeValue.ofInt(3), RuntimeValue.ofInt(4)), interp.stackItems());
        assertTrue(interp.appModule().findVariable("a").isPresent());

        assertThrows(InvalidVariableNameException.class, () -> interp.run("['__hidden'] VARIABLES"));
    }

    @Test
    void frozenModuleVariablesShouldBeCopiedPerInterpreter() {
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(new CoreModule());
        Module shared = new Module("shared", "Counter",
                "['count'] VARIABLES : SET-COUNT count ! ; : GET-COUNT count @ ; ['SET-COUNT' 'GET-COUNT'] EXPORT");
        registry.register(shared);
        new StandardInterpreter(registry, ZoneOffset.UTC).runModuleCode(shared);
        registry.freeze();

        Interpreter first = new StandardInterpreter(registry, ZoneOffset.UTC);
        first.useModule("shared", "");
        first.run("5 SET-COUNT GET-COUNT");
        assertEquals(List.of(RuntimeValue.ofInt(5)), first.stackItems());

        Interpreter second = new StandardInterpreter(registry, ZoneOffset.UTC);
        second.useModule("shared", "");
        second.run("GET-COUNT");
        assertEquals(List.of(RuntimeValue.NULL), second.stackItems());

        assertEquals(RuntimeValue.NULL, shared.findVariable("count").orElseThrow().value());
        assertThrows(ForthicException.class, () -> shared.addVariable("other"));
    }

    @Test
    void recoveryHandlerShouldResumeAfterTheFailingToken() {
        Interpreter interp = new StandardInterpreter();
        interp.setRecoveryHandler((error, i) -> i.push(RuntimeValue.ofString("recovered")), 2);
        interp.run("1 NOPE 2");
        assertEquals(List.of(RuntimeValue.ofInt(1), RuntimeValue.ofString("recovered"), RuntimeValue.ofInt(2)),
                interp.stackItems());

        TooManyAttemptsException error = assertThrows(TooManyAttemptsException.class, () -> interp.run("X Y Z"));
        assertEquals("TooManyAttemptsError", error.errorType());
    }

    @Test
    void wordErrorHandlerShouldTurnFailureIntoResult() {
        Interpreter interp = new StandardInterpreter();
        Module module = new Module("risky");
        NativeWord fail = module.addNativeWord("FAIL", "( -- )", "Always fails", (inputs, options) -> {
            throw new IllegalStateException("boom");
        });
        interp.importModule(module, "");

        NativeWordException error = assertThrows(NativeWordException.class, () -> interp.run("FAIL"));
        assertTrue(error.getMessage().contains("risky.FAIL"));

        fail.addErrorHandler((e, word, i) -> i.push(RuntimeValue.ofInt(-1)));
        interp.run("FAIL");
        assertEquals(List.of(RuntimeValue.ofInt(-1)), interp.stackItems());
    }

    @Test
    void resetShouldClearStackAndAppVariables() {
        Interpreter interp = new StandardInterpreter();
        interp.run("1 2 3 'v' !");
        interp.reset();
        assertEquals(0, interp.stackSize());
        assertTrue(interp.appModule().variables().isEmpty());
    }
}

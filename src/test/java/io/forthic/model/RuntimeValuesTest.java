package io.forthic.model;

import io.forthic.module.Variable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeValuesTest {
    @Test
    void serializabilityShouldLookInsideContainers() {
        RuntimeValue variable = new RuntimeValue.VariableRef(new Variable("x"));
        assertTrue(RuntimeValues.isSerializable(RuntimeValue.array(RuntimeValue.ofInt(1), RuntimeValue.NULL)));
        assertFalse(RuntimeValues.isSerializable(variable));
        assertFalse(RuntimeValues.isSerializable(RuntimeValue.array(RuntimeValue.array(variable))));

        Map<String, RuntimeValue> fields = new LinkedHashMap<>();
        fields.put("ref", variable);
        assertFalse(RuntimeValues.isSerializable(RuntimeValue.record(fields)));
    }

    @Test
    void displayShouldJoinArraysAndRenderRecordsAsJson() {
        Map<String, RuntimeValue> fields = new LinkedHashMap<>();
        fields.put("n", RuntimeValue.ofInt(1));
        fields.put("s", RuntimeValue.ofString("a"));
        assertEquals("1-a-null", RuntimeValues.display(
                RuntimeValue.array(RuntimeValue.ofInt(1), RuntimeValue.ofString("a"), RuntimeValue.NULL), "-"));
        assertEquals("{\"n\":1,\"s\":\"a\"}", RuntimeValues.display(RuntimeValue.record(fields), ", "));
        assertEquals("<Variable x>", RuntimeValues.describe(new RuntimeValue.VariableRef(new Variable("x"))));
    }

    @Test
    void missingShouldMeanNullOrEmptyString() {
        assertTrue(RuntimeValues.isMissing(RuntimeValue.NULL));
        assertTrue(RuntimeValues.isMissing(RuntimeValue.ofString("")));
        assertFalse(RuntimeValues.isMissing(RuntimeValue.ofInt(0)));
    }

    @Test
    void requireHelpersShouldRejectWrongKinds() {
        assertEquals("ok", RuntimeValues.requireString(RuntimeValue.ofString("ok"), "name"));
        assertThrows(IllegalArgumentException.class, () -> RuntimeValues.requireString(RuntimeValue.ofInt(1), "name"));
        assertThrows(IllegalArgumentException.class, () -> RuntimeValues.requireArray(RuntimeValue.NULL, "items"));
    }
}

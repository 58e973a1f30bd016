package io.forthic.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.forthic.error.ErrorInfo;
import io.forthic.model.RuntimeValue;
import io.forthic.module.Variable;
import io.forthic.util.Jsons;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WireCodecTest {
    @Test
    void nestedValuesShouldSurviveJsonText() {
        Map<String, RuntimeValue> inner = new LinkedHashMap<>();
        inner.put("deep", RuntimeValue.array(RuntimeValue.ofInt(1), RuntimeValue.array(RuntimeValue.ofString("x"))));
        inner.put("flag", RuntimeValue.ofBool(true));
        Map<String, RuntimeValue> outer = new LinkedHashMap<>();
        outer.put("inner", RuntimeValue.record(inner));
        outer.put("nothing", RuntimeValue.NULL);
        List<RuntimeValue> stack = List.of(
                RuntimeValue.array(RuntimeValue.record(outer), RuntimeValue.ofFloat(2.5)),
                RuntimeValue.ofString("")
        );

        List<RuntimeValue> decoded = WireCodec.decodeStack(Jsons.readTree(Jsons.toJson(WireCodec.encodeStack(stack))));
        assertEquals(stack, decoded);
    }

    @Test
    void deeplyNestedArraysShouldSurviveJsonText() {
        RuntimeValue value = RuntimeValue.ofInt(1);
        for (int i = 0; i < 400; i++) {
            value = RuntimeValue.array(value, RuntimeValue.record(Map.of("level", RuntimeValue.ofInt(i))));
        }
        List<RuntimeValue> stack = List.of(value);

        String pretty = Jsons.toJson(WireCodec.encodeStack(stack));
        assertEquals(stack, WireCodec.decodeStack(Jsons.readTree(pretty)));
        String compact = Jsons.toCompactJson(WireCodec.encodeResponse(ExecutionResponse.ok(stack)));
        assertEquals(stack, WireCodec.decodeResponse(Jsons.readTree(compact)).resultStack());
    }

    @Test
    void integersShouldTravelAsDecimalStringsWithoutPrecisionLoss() {
        ObjectNode max = WireCodec.encodeValue(RuntimeValue.ofInt(Long.MAX_VALUE));
        assertEquals("9223372036854775807", max.get("int_value").textValue());
        assertEquals(RuntimeValue.ofInt(Long.MIN_VALUE),
                WireCodec.decodeValue(Jsons.readTree(Jsons.toJson(WireCodec.encodeValue(RuntimeValue.ofInt(Long.MIN_VALUE))))));
        assertEquals(RuntimeValue.ofInt(7), WireCodec.decodeValue(Jsons.readTree("{\"int_value\": 7}")));
    }

    @Test
    void nonFiniteFloatsShouldUseNamedStrings() {
        assertEquals("NaN", WireCodec.encodeValue(RuntimeValue.ofFloat(Double.NaN)).get("float_value").textValue());
        assertEquals("-Infinity",
                WireCodec.encodeValue(RuntimeValue.ofFloat(Double.NEGATIVE_INFINITY)).get("float_value").textValue());
        RuntimeValue nan = WireCodec.decodeValue(Jsons.readTree("{\"float_value\": \"NaN\"}"));
        assertTrue(Double.isNaN(((RuntimeValue.FloatValue) nan).value()));
        RuntimeValue inf = WireCodec.decodeValue(Jsons.readTree("{\"float_value\": \"Infinity\"}"));
        assertEquals(Double.POSITIVE_INFINITY, ((RuntimeValue.FloatValue) inf).value());
    }

    @Test
    void temporalValuesShouldKeepTheirText() {
        RuntimeValue instant = RuntimeValue.InstantValue.of(Instant.parse("2025-05-24T10:15:00Z"));
        RuntimeValue date = RuntimeValue.PlainDateValue.of(LocalDate.of(2025, 5, 24));
        RuntimeValue zoned = RuntimeValue.ZonedDateTimeValue.of(
                ZonedDateTime.of(2025, 5, 24, 10, 15, 0, 0, ZoneId.of("America/Los_Angeles")));
        List<RuntimeValue> stack = List.of(instant, date, zoned);
        JsonNode encoded = WireCodec.encodeStack(stack);
        assertEquals("2025-05-24", encoded.get(1).path("plain_date_value").path("iso8601_date").asText());
        assertEquals("America/Los_Angeles", encoded.get(2).path("zoned_datetime_value").path("timezone").asText());
        assertEquals(stack, WireCodec.decodeStack(encoded));
    }

    @Test
    void inProcessValuesShouldNotEncode() {
        RuntimeValue variable = new RuntimeValue.VariableRef(new Variable("x"));
        assertThrows(IllegalArgumentException.class, () -> WireCodec.encodeValue(variable));
    }

    @Test
    void malformedValuesShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> WireCodec.decodeValue(Jsons.readTree("{}")));
        assertThrows(IllegalArgumentException.class,
                () -> WireCodec.decodeValue(Jsons.readTree("{\"int_value\": \"1\", \"bool_value\": true}")));
        assertThrows(IllegalArgumentException.class, () -> WireCodec.decodeValue(Jsons.readTree("{\"date_value\": 1}")));
        assertThrows(IllegalArgumentException.class, () -> WireCodec.decodeValue(Jsons.readTree("{\"int_value\": \"1.5\"}")));
        assertThrows(IllegalArgumentException.class, () -> WireCodec.decodeStack(Jsons.readTree("{\"a\": 1}")));
    }

    @Test
    void responseShouldCarryErrorOnlyOnFailure() {
        ObjectNode ok = WireCodec.encodeResponse(ExecutionResponse.ok(List.of(RuntimeValue.ofInt(1))));
        assertFalse(ok.has("error"));

        ErrorInfo error = new ErrorInfo("Unknown word: NOPE", "java", List.of("in X at a:1:1"),
                "UnknownWordError", "a:1:1", "", Map.of("word_name", "NOPE"));
        ObjectNode failed = WireCodec.encodeResponse(ExecutionResponse.fail(error));
        assertEquals(0, failed.get("result_stack").size());
        assertEquals("UnknownWordError", failed.path("error").path("error_type").asText());

        ExecutionResponse decoded = WireCodec.decodeResponse(Jsons.readTree(Jsons.toJson(failed)));
        assertTrue(decoded.isError());
        assertEquals(error, decoded.error());
    }

    @Test
    void requestsShouldDecodeFromSnakeCaseFields() {
        ExecuteSequenceRequest request = WireCodec.decodeExecuteSequenceRequest(Jsons.readTree(
                "{\"word_names\": [\"DUP\", \"SWAP\"], \"stack\": [{\"int_value\": \"5\"}]}"));
        assertEquals(List.of("DUP", "SWAP"), request.wordNames());
        assertEquals(List.of(RuntimeValue.ofInt(5)), request.stack());

        assertThrows(IllegalArgumentException.class,
                () -> WireCodec.decodeExecuteWordRequest(Jsons.readTree("{\"stack\": []}")));
        assertThrows(IllegalArgumentException.class,
                () -> WireCodec.decodeExecuteSequenceRequest(Jsons.readTree("{\"word_names\": []}")));
    }

    @Test
    void moduleListingShouldRoundTrip() {
        List<ModuleSummary> modules = List.of(new ModuleSummary("math", "Arithmetic", 30, true));
        assertEquals(modules, WireCodec.decodeModules(Jsons.readTree(Jsons.toJson(WireCodec.encodeModules(modules)))));

        ModuleInfo info = new ModuleInfo("math", "Arithmetic", List.of(new WordInfo("+", "( a b -- sum )", "Adds")));
        assertEquals(info, WireCodec.decodeModuleInfo(WireCodec.encodeModuleInfo(info)));
    }
}

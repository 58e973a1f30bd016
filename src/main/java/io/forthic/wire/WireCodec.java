package io.forthic.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.forthic.error.ErrorInfo;
import io.forthic.model.RuntimeValue;
import io.forthic.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of the bridge messages. Field names are snake_case and each stack value is
 * an object with exactly one variant field, e.g. {@code {"int_value": "42"}}.
 *
 * <p>64-bit integers travel as decimal strings so that JSON parsers backed by doubles do
 * not lose precision. Non-finite floats travel as {@code "NaN"}, {@code "Infinity"} and
 * {@code "-Infinity"}.
 */
public final class WireCodec {
    private WireCodec() {
    }

    // ----- stack values

    public static ObjectNode encodeValue(RuntimeValue value) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        switch (value.kind()) {
            case INT -> node.put("int_value", Long.toString(((RuntimeValue.IntValue) value).value()));
            case FLOAT -> encodeFloat(node, ((RuntimeValue.FloatValue) value).value());
            case BOOL -> node.put("bool_value", ((RuntimeValue.BoolValue) value).value());
            case STRING -> node.put("string_value", ((RuntimeValue.StringValue) value).value());
            case NULL -> node.putObject("null_value");
            case ARRAY -> node.putObject("array_value").set("items", encodeStack(((RuntimeValue.ArrayValue) value).items()));
            case RECORD -> {
                ObjectNode fields = node.putObject("record_value").putObject("fields");
                for (Map.Entry<String, RuntimeValue> entry : ((RuntimeValue.RecordValue) value).fields().entrySet()) {
                    fields.set(entry.getKey(), encodeValue(entry.getValue()));
                }
            }
            case INSTANT -> node.putObject("instant_value").put("iso8601", ((RuntimeValue.InstantValue) value).iso8601());
            case PLAIN_DATE -> node.putObject("plain_date_value")
                    .put("iso8601_date", ((RuntimeValue.PlainDateValue) value).iso8601Date());
            case ZONED_DATETIME -> {
                RuntimeValue.ZonedDateTimeValue zoned = (RuntimeValue.ZonedDateTimeValue) value;
                node.putObject("zoned_datetime_value")
                        .put("iso8601", zoned.iso8601())
                        .put("timezone", zoned.timezone());
            }
            default -> throw new IllegalArgumentException(
                    "cannot serialize in-process " + value.kind().label() + " value");
        }
        return node;
    }

    private static void encodeFloat(ObjectNode node, double value) {
        if (Double.isNaN(value)) {
            node.put("float_value", "NaN");
        } else if (Double.isInfinite(value)) {
            node.put("float_value", value > 0 ? "Infinity" : "-Infinity");
        } else {
            node.put("float_value", value);
        }
    }

    public static RuntimeValue decodeValue(JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw new IllegalArgumentException("stack value must be an object with exactly one variant field");
        }
        Map.Entry<String, JsonNode> variant = node.fields().next();
        JsonNode body = variant.getValue();
        switch (variant.getKey()) {
            case "int_value":
                return RuntimeValue.ofInt(decodeLong(body));
            case "float_value":
                return RuntimeValue.ofFloat(decodeDouble(body));
            case "bool_value":
                if (!body.isBoolean()) {
                    throw new IllegalArgumentException("bool_value must be a boolean");
                }
                return RuntimeValue.ofBool(body.booleanValue());
            case "string_value":
                if (!body.isTextual()) {
                    throw new IllegalArgumentException("string_value must be a string");
                }
                return RuntimeValue.ofString(body.textValue());
            case "null_value":
                return RuntimeValue.NULL;
            case "array_value":
                return RuntimeValue.array(decodeStack(body.path("items")));
            case "record_value": {
                Map<String, RuntimeValue> fields = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> entries = body.path("fields").fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    fields.put(entry.getKey(), decodeValue(entry.getValue()));
                }
                return RuntimeValue.record(fields);
            }
            case "instant_value":
                return new RuntimeValue.InstantValue(requireText(body, "iso8601"));
            case "plain_date_value":
                return new RuntimeValue.PlainDateValue(requireText(body, "iso8601_date"));
            case "zoned_datetime_value":
                return new RuntimeValue.ZonedDateTimeValue(requireText(body, "iso8601"), body.path("timezone").asText(""));
            default:
                throw new IllegalArgumentException("unknown stack value variant: " + variant.getKey());
        }
    }

    private static long decodeLong(JsonNode body) {
        if (body.isIntegralNumber() && body.canConvertToLong()) {
            return body.longValue();
        }
        if (body.isTextual()) {
            try {
                return Long.parseLong(body.textValue());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("int_value is not a 64-bit integer: " + body.textValue(), e);
            }
        }
        throw new IllegalArgumentException("int_value must be a decimal string or integer");
    }

    private static double decodeDouble(JsonNode body) {
        if (body.isNumber()) {
            return body.doubleValue();
        }
        if (body.isTextual()) {
            switch (body.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("float_value must be a number, \"NaN\", \"Infinity\" or \"-Infinity\"");
    }

    private static String requireText(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return value.textValue();
    }

    public static ArrayNode encodeStack(List<RuntimeValue> values) {
        ArrayNode array = Jsons.mapper().createArrayNode();
        for (RuntimeValue value : values) {
            array.add(encodeValue(value));
        }
        return array;
    }

    public static List<RuntimeValue> decodeStack(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("stack must be an array");
        }
        List<RuntimeValue> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(decodeValue(item));
        }
        return values;
    }

    // ----- errors

    public static ObjectNode encodeError(ErrorInfo error) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("message", error.message());
        node.put("runtime", error.runtime());
        ArrayNode frames = node.putArray("stack_trace");
        error.stackTrace().forEach(frames::add);
        node.put("error_type", error.errorType());
        node.put("word_location", error.wordLocation());
        node.put("module_name", error.moduleName());
        ObjectNode context = node.putObject("context");
        error.context().forEach(context::put);
        return node;
    }

    public static ErrorInfo decodeError(JsonNode node) {
        List<String> frames = new ArrayList<>();
        for (JsonNode frame : node.path("stack_trace")) {
            frames.add(frame.asText());
        }
        Map<String, String> context = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.path("context").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            context.put(entry.getKey(), entry.getValue().asText());
        }
        return new ErrorInfo(
                node.path("message").asText(""),
                node.path("runtime").asText(""),
                frames,
                node.path("error_type").asText(""),
                node.path("word_location").asText(""),
                node.path("module_name").asText(""),
                context
        );
    }

    // ----- requests and responses

    public static ObjectNode encodeExecuteWordRequest(ExecuteWordRequest request) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("word_name", request.wordName());
        node.set("stack", encodeStack(request.stack()));
        return node;
    }

    public static ExecuteWordRequest decodeExecuteWordRequest(JsonNode node) {
        return new ExecuteWordRequest(node.path("word_name").asText(""), decodeStack(node.get("stack")));
    }

    public static ObjectNode encodeExecuteSequenceRequest(ExecuteSequenceRequest request) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        ArrayNode names = node.putArray("word_names");
        request.wordNames().forEach(names::add);
        node.set("stack", encodeStack(request.stack()));
        return node;
    }

    public static ExecuteSequenceRequest decodeExecuteSequenceRequest(JsonNode node) {
        List<String> names = new ArrayList<>();
        for (JsonNode name : node.path("word_names")) {
            if (!name.isTextual()) {
                throw new IllegalArgumentException("word_names must contain strings");
            }
            names.add(name.textValue());
        }
        return new ExecuteSequenceRequest(names, decodeStack(node.get("stack")));
    }

    public static ObjectNode encodeResponse(ExecutionResponse response) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.set("result_stack", encodeStack(response.resultStack()));
        if (response.error() != null) {
            node.set("error", encodeError(response.error()));
        }
        return node;
    }

    public static ExecutionResponse decodeResponse(JsonNode node) {
        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            return ExecutionResponse.fail(decodeError(error));
        }
        return ExecutionResponse.ok(decodeStack(node.get("result_stack")));
    }

    public static ObjectNode encodeModules(List<ModuleSummary> modules) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        ArrayNode array = node.putArray("modules");
        for (ModuleSummary module : modules) {
            array.addObject()
                    .put("name", module.name())
                    .put("description", module.description())
                    .put("word_count", module.wordCount())
                    .put("runtime_specific", module.runtimeSpecific());
        }
        return node;
    }

    public static List<ModuleSummary> decodeModules(JsonNode node) {
        List<ModuleSummary> modules = new ArrayList<>();
        for (JsonNode module : node.path("modules")) {
            modules.add(new ModuleSummary(
                    module.path("name").asText(""),
                    module.path("description").asText(""),
                    module.path("word_count").asInt(0),
                    module.path("runtime_specific").asBoolean(false)
            ));
        }
        return modules;
    }

    public static ObjectNode encodeModuleInfo(ModuleInfo info) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("name", info.name());
        node.put("description", info.description());
        ArrayNode words = node.putArray("words");
        for (WordInfo word : info.words()) {
            words.addObject()
                    .put("name", word.name())
                    .put("stack_effect", word.stackEffect())
                    .put("description", word.description());
        }
        return node;
    }

    public static ModuleInfo decodeModuleInfo(JsonNode node) {
        List<WordInfo> words = new ArrayList<>();
        for (JsonNode word : node.path("words")) {
            words.add(new WordInfo(
                    word.path("name").asText(""),
                    word.path("stack_effect").asText(""),
                    word.path("description").asText("")
            ));
        }
        return new ModuleInfo(node.path("name").asText(""), node.path("description").asText(""), words);
    }
}

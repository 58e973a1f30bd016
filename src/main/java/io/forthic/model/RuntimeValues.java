package io.forthic.model;

import io.forthic.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RuntimeValues {
    private RuntimeValues() {
    }

    /**
     * True when the value and everything nested in it can cross the wire.
     */
    public static boolean isSerializable(RuntimeValue value) {
        if (!value.kind().serializable()) {
            return false;
        }
        switch (value.kind()) {
            case ARRAY:
                for (RuntimeValue item : ((RuntimeValue.ArrayValue) value).items()) {
                    if (!isSerializable(item)) {
                        return false;
                    }
                }
                return true;
            case RECORD:
                for (RuntimeValue field : ((RuntimeValue.RecordValue) value).fields().values()) {
                    if (!isSerializable(field)) {
                        return false;
                    }
                }
                return true;
            default:
                return true;
        }
    }

    /**
     * Converts to plain Java objects (Long, Double, Boolean, String, null, List, Map) as
     * used for JSON output. Temporal values become their ISO-8601 text.
     */
    public static Object toPlain(RuntimeValue value) {
        switch (value.kind()) {
            case INT:
                return ((RuntimeValue.IntValue) value).value();
            case FLOAT:
                return ((RuntimeValue.FloatValue) value).value();
            case BOOL:
                return ((RuntimeValue.BoolValue) value).value();
            case STRING:
                return ((RuntimeValue.StringValue) value).value();
            case NULL:
                return null;
            case ARRAY: {
                List<Object> items = new ArrayList<>();
                for (RuntimeValue item : ((RuntimeValue.ArrayValue) value).items()) {
                    items.add(toPlain(item));
                }
                return items;
            }
            case RECORD: {
                Map<String, Object> fields = new LinkedHashMap<>();
                for (Map.Entry<String, RuntimeValue> entry : ((RuntimeValue.RecordValue) value).fields().entrySet()) {
                    fields.put(entry.getKey(), toPlain(entry.getValue()));
                }
                return fields;
            }
            case INSTANT:
                return ((RuntimeValue.InstantValue) value).iso8601();
            case PLAIN_DATE:
                return ((RuntimeValue.PlainDateValue) value).iso8601Date();
            case ZONED_DATETIME:
                return ((RuntimeValue.ZonedDateTimeValue) value).iso8601();
            default:
                return describe(value);
        }
    }

    public static String toJson(RuntimeValue value) {
        return Jsons.toCompactJson(toPlain(value));
    }

    /**
     * Text shown to a user for the value, as printed and interpolated.
     */
    public static String display(RuntimeValue value, String separator) {
        switch (value.kind()) {
            case STRING:
                return ((RuntimeValue.StringValue) value).value();
            case NULL:
                return "null";
            case ARRAY: {
                List<String> parts = new ArrayList<>();
                for (RuntimeValue item : ((RuntimeValue.ArrayValue) value).items()) {
                    parts.add(display(item, separator));
                }
                return String.join(separator, parts);
            }
            case RECORD:
                return toJson(value);
            case WORD:
            case MODULE:
            case VARIABLE:
            case OPTIONS:
                return describe(value);
            default:
                return String.valueOf(toPlain(value));
        }
    }

    public static String describe(RuntimeValue value) {
        switch (value.kind()) {
            case WORD:
                return "<Word " + ((RuntimeValue.WordRef) value).word().name() + ">";
            case MODULE:
                return "<Module " + ((RuntimeValue.ModuleRef) value).module().name() + ">";
            case VARIABLE:
                return "<Variable " + ((RuntimeValue.VariableRef) value).variable().name() + ">";
            case OPTIONS:
                return ((RuntimeValue.OptionsValue) value).options().toString();
            default:
                return display(value, " ");
        }
    }

    public static String requireString(RuntimeValue value, String what) {
        if (value.kind() != RuntimeValue.Kind.STRING) {
            throw new IllegalArgumentException(what + " must be a string, got " + value.kind().label());
        }
        return ((RuntimeValue.StringValue) value).value();
    }

    public static RuntimeValue.ArrayValue requireArray(RuntimeValue value, String what) {
        if (value.kind() != RuntimeValue.Kind.ARRAY) {
            throw new IllegalArgumentException(what + " must be an array, got " + value.kind().label());
        }
        return (RuntimeValue.ArrayValue) value;
    }

    public static boolean isNull(RuntimeValue value) {
        return value == null || value.kind() == RuntimeValue.Kind.NULL;
    }

    /**
     * Empty strings count as missing, matching how default-value words treat them.
     */
    public static boolean isMissing(RuntimeValue value) {
        if (isNull(value)) {
            return true;
        }
        return value.kind() == RuntimeValue.Kind.STRING && ((RuntimeValue.StringValue) value).value().isEmpty();
    }
}

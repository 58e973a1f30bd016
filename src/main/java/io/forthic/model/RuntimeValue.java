package io.forthic.model;

import io.forthic.module.Module;
import io.forthic.module.Variable;
import io.forthic.module.Word;
import io.forthic.module.WordOptions;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value on the operand stack. Exactly one variant is active per value; {@code int}
 * and {@code float} are distinct variants and never coerced into each other.
 *
 * <p>Word, module, variable and options references exist only inside one process and
 * are rejected by the wire codec.
 */
public interface RuntimeValue {
    NullValue NULL = new NullValue();

    Kind kind();

    static IntValue ofInt(long value) {
        return new IntValue(value);
    }

    static FloatValue ofFloat(double value) {
        return new FloatValue(value);
    }

    static BoolValue ofBool(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static StringValue ofString(String value) {
        return new StringValue(value);
    }

    static ArrayValue array(List<RuntimeValue> items) {
        return new ArrayValue(items);
    }

    static ArrayValue array(RuntimeValue... items) {
        return new ArrayValue(Arrays.asList(items));
    }

    static RecordValue record(Map<String, RuntimeValue> fields) {
        return new RecordValue(fields);
    }

    enum Kind {
        INT("int", true),
        FLOAT("float", true),
        BOOL("bool", true),
        STRING("string", true),
        NULL("null", true),
        ARRAY("array", true),
        RECORD("record", true),
        INSTANT("instant", true),
        PLAIN_DATE("plain_date", true),
        ZONED_DATETIME("zoned_datetime", true),
        WORD("word", false),
        MODULE("module", false),
        VARIABLE("variable", false),
        OPTIONS("options", false);

        private final String label;
        private final boolean serializable;

        Kind(String label, boolean serializable) {
            this.label = label;
            this.serializable = serializable;
        }

        public String label() {
            return label;
        }

        public boolean serializable() {
            return serializable;
        }
    }

    record IntValue(long value) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.INT;
        }
    }

    record FloatValue(double value) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }
    }

    record BoolValue(boolean value) implements RuntimeValue {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }
    }

    record StringValue(String value) implements RuntimeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record NullValue() implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record ArrayValue(List<RuntimeValue> items) implements RuntimeValue {
        public ArrayValue {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        public RuntimeValue get(int index) {
            return items.get(index);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /**
     * Insertion-ordered fields with unique keys; when built from pairs the last write wins.
     */
    record RecordValue(Map<String, RuntimeValue> fields) implements RuntimeValue {
        public RecordValue {
            Map<String, RuntimeValue> copy = new LinkedHashMap<>();
            for (Map.Entry<String, RuntimeValue> entry : fields.entrySet()) {
                copy.put(Objects.requireNonNull(entry.getKey(), "field name"),
                        Objects.requireNonNull(entry.getValue(), "field value"));
            }
            fields = Collections.unmodifiableMap(copy);
        }

        public RuntimeValue get(String key) {
            return fields.get(key);
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }
    }

    record InstantValue(String iso8601) implements RuntimeValue {
        public InstantValue {
            Objects.requireNonNull(iso8601, "iso8601");
        }

        public static InstantValue of(Instant instant) {
            return new InstantValue(instant.toString());
        }

        public Instant toInstant() {
            try {
                return Instant.parse(iso8601);
            } catch (DateTimeParseException e) {
                return OffsetDateTime.parse(iso8601).toInstant();
            }
        }

        @Override
        public Kind kind() {
            return Kind.INSTANT;
        }
    }

    record PlainDateValue(String iso8601Date) implements RuntimeValue {
        public PlainDateValue {
            Objects.requireNonNull(iso8601Date, "iso8601Date");
        }

        public static PlainDateValue of(LocalDate date) {
            return new PlainDateValue(date.toString());
        }

        public LocalDate toLocalDate() {
            return LocalDate.parse(iso8601Date);
        }

        @Override
        public Kind kind() {
            return Kind.PLAIN_DATE;
        }
    }

    record ZonedDateTimeValue(String iso8601, String timezone) implements RuntimeValue {
        public ZonedDateTimeValue {
            Objects.requireNonNull(iso8601, "iso8601");
            timezone = timezone == null ? "" : timezone;
        }

        public static ZonedDateTimeValue of(ZonedDateTime dateTime) {
            return new ZonedDateTimeValue(
                    DateTimeFormatter.ISO_ZONED_DATE_TIME.format(dateTime),
                    dateTime.getZone().getId());
        }

        public ZonedDateTime toZonedDateTime() {
            ZonedDateTime parsed = ZonedDateTime.parse(iso8601, DateTimeFormatter.ISO_ZONED_DATE_TIME);
            if (iso8601.indexOf('[') < 0 && !timezone.isBlank()) {
                return parsed.withZoneSameInstant(ZoneId.of(timezone));
            }
            return parsed;
        }

        @Override
        public Kind kind() {
            return Kind.ZONED_DATETIME;
        }
    }

    record WordRef(Word word) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.WORD;
        }
    }

    record ModuleRef(Module module) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.MODULE;
        }
    }

    record VariableRef(Variable variable) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }
    }

    record OptionsValue(WordOptions options) implements RuntimeValue {
        @Override
        public Kind kind() {
            return Kind.OPTIONS;
        }
    }
}

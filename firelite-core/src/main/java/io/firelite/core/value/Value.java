package io.firelite.core.value;

import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.firelite.core.error.FireliteException;

/**
 * A single document field value. Exactly one variant is ever populated; the
 * variant is identified by {@link #kind()}.
 *
 * <p>All variants are immutable, so documents built from them can be shared
 * between the live store and transaction snapshots without copying.</p>
 */
public sealed interface Value permits Value.NullValue, Value.BooleanValue, Value.IntegerValue,
        Value.DoubleValue, Value.TimestampValue, Value.StringValue, Value.BytesValue,
        Value.ReferenceValue, Value.GeoPointValue, Value.ArrayValue, Value.MapValue {

    enum Kind {
        NULL("nullValue"),
        BOOLEAN("booleanValue"),
        INTEGER("integerValue"),
        DOUBLE("doubleValue"),
        TIMESTAMP("timestampValue"),
        STRING("stringValue"),
        BYTES("bytesValue"),
        REFERENCE("referenceValue"),
        GEO_POINT("geoPointValue"),
        ARRAY("arrayValue"),
        MAP("mapValue");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Kind fromWireName(String name) {
            for (Kind kind : values()) {
                if (kind.wireName.equals(name)) {
                    return kind;
                }
            }
            return null;
        }
    }

    Kind kind();

    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    static Value of(boolean value) {
        return new BooleanValue(value);
    }

    static Value of(long value) {
        return new IntegerValue(value);
    }

    static Value of(double value) {
        return new DoubleValue(value);
    }

    static Value of(String value) {
        return new StringValue(value);
    }

    static Value of(Instant value) {
        return new TimestampValue(value);
    }

    static Value array(Value... values) {
        return new ArrayValue(Arrays.asList(values));
    }

    static Value map(Map<String, Value> fields) {
        return new MapValue(fields);
    }

    /**
     * True for integer and double values.
     */
    static boolean isNumber(Value value) {
        return value instanceof IntegerValue || value instanceof DoubleValue;
    }

    final class NullValue implements Value {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanValue(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record IntegerValue(long value) implements Value {
        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }
    }

    record DoubleValue(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }
    }

    record TimestampValue(Instant value) implements Value {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.TIMESTAMP;
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record BytesValue(byte[] value) implements Value {
        public BytesValue {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public Kind kind() {
            return Kind.BYTES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue && Arrays.equals(value, ((BytesValue) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + Base64.getEncoder().encodeToString(value) + "]";
        }
    }

    record ReferenceValue(String value) implements Value {
        public ReferenceValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }
    }

    record GeoPointValue(double latitude, double longitude) implements Value {
        public GeoPointValue {
            if (!(latitude >= -90 && latitude <= 90)) {
                throw FireliteException.invalidArgument("Latitude must be between -90 and 90, got " + latitude);
            }
            if (!(longitude >= -180 && longitude <= 180)) {
                throw FireliteException.invalidArgument("Longitude must be between -180 and 180, got " + longitude);
            }
        }

        @Override
        public Kind kind() {
            return Kind.GEO_POINT;
        }
    }

    record ArrayValue(List<Value> values) implements Value {
        public ArrayValue {
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    record MapValue(Map<String, Value> fields) implements Value {
        public MapValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }
    }
}

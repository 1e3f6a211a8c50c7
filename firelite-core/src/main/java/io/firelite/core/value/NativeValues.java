package io.firelite.core.value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts plain Java values to {@link Value} and back.
 *
 * <p>Supported native types: {@code null}, {@link Boolean}, integral
 * {@link Number}s, {@link Float}/{@link Double}, {@link String},
 * {@link Instant}/{@link Date}, {@code byte[]}, {@link GeoPoint},
 * {@link DocumentReference}, {@link List} and {@link Map} with string keys.</p>
 */
public final class NativeValues {
    public static final String DEFAULT_DATABASE = "(default)";

    private static final Pattern REFERENCE = Pattern.compile("^projects/[^/]+/databases/[^/]+/documents/(.+)$");

    private final String projectId;
    private final String databaseId;

    public NativeValues(String projectId) {
        this(projectId, DEFAULT_DATABASE);
    }

    public NativeValues(String projectId, String databaseId) {
        this.projectId = projectId;
        this.databaseId = databaseId;
    }

    public Value encode(Object value) {
        return encode(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public Map<String, Value> encodeFields(Map<String, ?> fields) {
        Map<String, Value> result = new LinkedHashMap<>();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            result.put(entry.getKey(), encode(entry.getValue(), seen));
        }
        return result;
    }

    private Value encode(Object value, Set<Object> seen) {
        if (value == null) {
            return Value.nullValue();
        }
        if (value instanceof Boolean) {
            return new Value.BooleanValue((Boolean) value);
        }
        if (value instanceof Double || value instanceof Float) {
            return new Value.DoubleValue(((Number) value).doubleValue());
        }
        if (value instanceof BigInteger) {
            try {
                return new Value.IntegerValue(((BigInteger) value).longValueExact());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Integer out of 64-bit range: " + value);
            }
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Value.IntegerValue(((Number) value).longValue());
        }
        if (value instanceof String) {
            return new Value.StringValue((String) value);
        }
        if (value instanceof Instant) {
            return new Value.TimestampValue((Instant) value);
        }
        if (value instanceof Date) {
            return new Value.TimestampValue(((Date) value).toInstant());
        }
        if (value instanceof byte[]) {
            return new Value.BytesValue((byte[]) value);
        }
        if (value instanceof GeoPoint) {
            GeoPoint geo = (GeoPoint) value;
            return new Value.GeoPointValue(geo.latitude(), geo.longitude());
        }
        if (value instanceof DocumentReference) {
            if (projectId == null) {
                throw new IllegalArgumentException("projectId is required to encode DocumentReference");
            }
            return new Value.ReferenceValue("projects/" + projectId + "/databases/" + databaseId
                    + "/documents/" + ((DocumentReference) value).path());
        }
        if (value instanceof Value) {
            return (Value) value;
        }
        if (value instanceof List) {
            if (!seen.add(value)) {
                throw new IllegalArgumentException("Cannot encode circular reference");
            }
            List<Value> values = new ArrayList<>();
            for (Object item : (List<?>) value) {
                values.add(encode(item, seen));
            }
            seen.remove(value);
            return new Value.ArrayValue(values);
        }
        if (value instanceof Map) {
            if (!seen.add(value)) {
                throw new IllegalArgumentException("Cannot encode circular reference");
            }
            Map<String, Value> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("Map keys must be strings, got " + entry.getKey());
                }
                fields.put((String) entry.getKey(), encode(entry.getValue(), seen));
            }
            seen.remove(value);
            return new Value.MapValue(fields);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * Decodes to native Java values. References decode to their path relative
     * to the database root, or to a {@link DocumentReference} when
     * {@code preserveReferences} is set.
     */
    public static Object decode(Value value, boolean preserveReferences) {
        switch (value.kind()) {
            case NULL:
                return null;
            case BOOLEAN:
                return ((Value.BooleanValue) value).value();
            case INTEGER:
                return ((Value.IntegerValue) value).value();
            case DOUBLE:
                return ((Value.DoubleValue) value).value();
            case TIMESTAMP:
                return ((Value.TimestampValue) value).value();
            case STRING:
                return ((Value.StringValue) value).value();
            case BYTES:
                return ((Value.BytesValue) value).value();
            case REFERENCE:
                String ref = ((Value.ReferenceValue) value).value();
                Matcher m = REFERENCE.matcher(ref);
                if (!m.matches()) {
                    throw new IllegalArgumentException("Invalid referenceValue format: " + ref);
                }
                return preserveReferences ? new DocumentReference(m.group(1)) : m.group(1);
            case GEO_POINT:
                Value.GeoPointValue geo = (Value.GeoPointValue) value;
                return new GeoPoint(geo.latitude(), geo.longitude());
            case ARRAY:
                List<Object> list = new ArrayList<>();
                for (Value item : ((Value.ArrayValue) value).values()) {
                    list.add(decode(item, preserveReferences));
                }
                return list;
            case MAP:
                return decodeFields(((Value.MapValue) value).fields(), preserveReferences);
            default:
                throw new IllegalArgumentException("Unsupported Value type: " + value.kind());
        }
    }

    public static Object decode(Value value) {
        return decode(value, false);
    }

    public static Map<String, Object> decodeFields(Map<String, Value> fields, boolean preserveReferences) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : fields.entrySet()) {
            result.put(entry.getKey(), decode(entry.getValue(), preserveReferences));
        }
        return result;
    }
}

package io.firelite.core.value;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Deep equality over {@link Value} trees as used by array transforms and
 * conflict detection.
 *
 * <p>Differs from {@code equals} in two places: doubles compare numerically
 * with {@code NaN} equal to {@code NaN} (so {@code 0.0} equals {@code -0.0}),
 * and timestamps compare at millisecond precision.</p>
 */
public final class ValueEquality {

    private ValueEquality() {
    }

    public static boolean equal(Value a, Value b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.kind() != b.kind()) {
            return false;
        }
        switch (a.kind()) {
            case NULL:
                return true;
            case BOOLEAN:
                return ((Value.BooleanValue) a).value() == ((Value.BooleanValue) b).value();
            case INTEGER:
                return ((Value.IntegerValue) a).value() == ((Value.IntegerValue) b).value();
            case DOUBLE:
                double x = ((Value.DoubleValue) a).value();
                double y = ((Value.DoubleValue) b).value();
                if (Double.isNaN(x) && Double.isNaN(y)) {
                    return true;
                }
                return x == y;
            case TIMESTAMP:
                return ((Value.TimestampValue) a).value().truncatedTo(ChronoUnit.MILLIS)
                        .equals(((Value.TimestampValue) b).value().truncatedTo(ChronoUnit.MILLIS));
            case STRING:
                return ((Value.StringValue) a).value().equals(((Value.StringValue) b).value());
            case BYTES:
                return Arrays.equals(((Value.BytesValue) a).value(), ((Value.BytesValue) b).value());
            case REFERENCE:
                return ((Value.ReferenceValue) a).value().equals(((Value.ReferenceValue) b).value());
            case GEO_POINT:
                Value.GeoPointValue ga = (Value.GeoPointValue) a;
                Value.GeoPointValue gb = (Value.GeoPointValue) b;
                return ga.latitude() == gb.latitude() && ga.longitude() == gb.longitude();
            case ARRAY:
                return arraysEqual(((Value.ArrayValue) a).values(), ((Value.ArrayValue) b).values());
            case MAP:
                return fieldsEqual(((Value.MapValue) a).fields(), ((Value.MapValue) b).fields());
            default:
                return false;
        }
    }

    public static boolean fieldsEqual(Map<String, Value> a, Map<String, Value> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<String, Value> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey()) || !equal(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when any element of {@code values} is deep-equal to {@code candidate}.
     */
    public static boolean contains(List<Value> values, Value candidate) {
        for (Value value : values) {
            if (equal(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean arraysEqual(List<Value> a, List<Value> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!equal(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}

package io.firelite.core.write;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.firelite.core.value.Value;
import io.firelite.core.value.ValueEquality;

/**
 * Applies field transforms to a document's fields.
 */
public final class FieldTransforms {

    /**
     * Transformed fields plus one result per transform, in request order.
     */
    public record Result(Map<String, Value> fields, List<Value> transformResults) {
    }

    private FieldTransforms() {
    }

    /**
     * Applies {@code transforms} in order to a copy of {@code fields}. Each
     * transform sees the output of the ones before it.
     */
    public static Result apply(Map<String, Value> fields, List<FieldTransform> transforms, Instant requestTime) {
        Map<String, Value> result = new LinkedHashMap<>(fields);
        List<Value> results = new ArrayList<>(transforms.size());
        for (FieldTransform transform : transforms) {
            Value current = transform.getFieldPath().get(result);
            Value next = applyOne(transform, current, requestTime);
            transform.getFieldPath().set(result, next);
            results.add(next);
        }
        return new Result(result, results);
    }

    static Value applyOne(FieldTransform transform, Value current, Instant requestTime) {
        switch (transform.getType()) {
            case REQUEST_TIME:
                return Value.of(requestTime);
            case INCREMENT:
                return increment(current, transform.getOperand());
            case MAXIMUM:
                return extreme(current, transform.getOperand(), true);
            case MINIMUM:
                return extreme(current, transform.getOperand(), false);
            case APPEND_MISSING_ELEMENTS:
                return appendMissing(current, transform.getElements());
            case REMOVE_ALL_FROM_ARRAY:
                return removeAll(current, transform.getElements());
            default:
                throw new IllegalStateException("Unhandled transform " + transform.getType());
        }
    }

    static Value increment(Value current, Value delta) {
        Value base = Value.isNumber(current) ? current : Value.of(0L);
        if (isIntegral(base) && isIntegral(delta)) {
            long a = toLong(base);
            long b = toLong(delta);
            long sum = a + b;
            // saturate on overflow
            if (((a ^ sum) & (b ^ sum)) < 0) {
                return Value.of(a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
            }
            return Value.of(sum);
        }
        return Value.of(toDouble(base) + toDouble(delta));
    }

    static Value extreme(Value current, Value operand, boolean maximum) {
        if (!Value.isNumber(current)) {
            return operand;
        }
        if (isIntegral(current) && isIntegral(operand)) {
            long a = toLong(current);
            long b = toLong(operand);
            return Value.of(maximum ? Math.max(a, b) : Math.min(a, b));
        }
        double a = toDouble(current);
        double b = toDouble(operand);
        // NaN orders below every other number
        double chosen;
        if (Double.isNaN(a)) {
            chosen = maximum ? b : a;
        } else if (Double.isNaN(b)) {
            chosen = maximum ? a : b;
        } else {
            chosen = maximum ? Math.max(a, b) : Math.min(a, b);
        }
        return Value.of(chosen);
    }

    static Value appendMissing(Value current, List<Value> elements) {
        List<Value> existing = current instanceof Value.ArrayValue
                ? ((Value.ArrayValue) current).values()
                : List.of();
        List<Value> values = new ArrayList<>(existing);
        for (Value element : elements) {
            if (!ValueEquality.contains(existing, element)) {
                values.add(element);
            }
        }
        return new Value.ArrayValue(values);
    }

    static Value removeAll(Value current, List<Value> elements) {
        if (!(current instanceof Value.ArrayValue)) {
            return new Value.ArrayValue(List.of());
        }
        List<Value> values = new ArrayList<>();
        for (Value value : ((Value.ArrayValue) current).values()) {
            if (!ValueEquality.contains(elements, value)) {
                values.add(value);
            }
        }
        return new Value.ArrayValue(values);
    }

    /**
     * Integer values, and doubles holding a whole number within the long
     * range, count as integral when choosing the result type.
     */
    static boolean isIntegral(Value value) {
        if (value instanceof Value.IntegerValue) {
            return true;
        }
        double d = ((Value.DoubleValue) value).value();
        return !Double.isInfinite(d) && d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
    }

    private static long toLong(Value value) {
        return value instanceof Value.IntegerValue
                ? ((Value.IntegerValue) value).value()
                : (long) ((Value.DoubleValue) value).value();
    }

    private static double toDouble(Value value) {
        return value instanceof Value.IntegerValue
                ? ((Value.IntegerValue) value).value()
                : ((Value.DoubleValue) value).value();
    }
}

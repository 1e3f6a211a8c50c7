package io.firelite.core.write;

import java.util.List;

import io.firelite.core.document.FieldPath;
import io.firelite.core.error.FireliteException;
import io.firelite.core.value.Value;

/**
 * A server-computed mutation of one field. Operands are checked at
 * construction so that applying a transform never fails.
 */
public final class FieldTransform {

    public enum Type {
        REQUEST_TIME,
        INCREMENT,
        MAXIMUM,
        MINIMUM,
        APPEND_MISSING_ELEMENTS,
        REMOVE_ALL_FROM_ARRAY
    }

    private final FieldPath fieldPath;
    private final Type type;
    private final Value operand;
    private final List<Value> elements;

    private FieldTransform(String fieldPath, Type type, Value operand, List<Value> elements) {
        this.fieldPath = FieldPath.parse(fieldPath);
        this.type = type;
        this.operand = operand;
        this.elements = elements == null ? null : List.copyOf(elements);
    }

    public static FieldTransform requestTime(String fieldPath) {
        return new FieldTransform(fieldPath, Type.REQUEST_TIME, null, null);
    }

    public static FieldTransform increment(String fieldPath, Value delta) {
        return new FieldTransform(fieldPath, Type.INCREMENT, requireNumber("increment", delta), null);
    }

    public static FieldTransform maximum(String fieldPath, Value value) {
        return new FieldTransform(fieldPath, Type.MAXIMUM, requireNumber("maximum", value), null);
    }

    public static FieldTransform minimum(String fieldPath, Value value) {
        return new FieldTransform(fieldPath, Type.MINIMUM, requireNumber("minimum", value), null);
    }

    public static FieldTransform appendMissingElements(String fieldPath, List<Value> values) {
        return new FieldTransform(fieldPath, Type.APPEND_MISSING_ELEMENTS, null, values);
    }

    public static FieldTransform removeAllFromArray(String fieldPath, List<Value> values) {
        return new FieldTransform(fieldPath, Type.REMOVE_ALL_FROM_ARRAY, null, values);
    }

    private static Value requireNumber(String name, Value value) {
        if (!Value.isNumber(value)) {
            throw FireliteException.invalidArgument(name + " requires an integer or double operand");
        }
        return value;
    }

    public FieldPath getFieldPath() {
        return fieldPath;
    }

    public Type getType() {
        return type;
    }

    public Value getOperand() {
        return operand;
    }

    public List<Value> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "FieldTransform[" + fieldPath + " " + type + "]";
    }
}

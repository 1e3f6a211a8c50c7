package io.firelite.core.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.firelite.core.error.FireliteException;
import io.firelite.core.value.Value;

/**
 * Dot-separated field path navigation over nested map values.
 *
 * <p>Segments containing dots are quoted with backticks:
 * {@code `a.b`.c} addresses field {@code c} inside the field named {@code a.b}.</p>
 */
public final class FieldPath {
    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static FieldPath parse(String path) {
        if (path == null || path.isEmpty()) {
            throw FireliteException.invalidArgument("Field path cannot be empty");
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '`') {
                quoted = !quoted;
                continue;
            }
            if (c == '.' && !quoted) {
                if (current.length() == 0) {
                    throw FireliteException.invalidArgument("Invalid field path: empty segment at position " + i);
                }
                segments.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (quoted) {
            throw FireliteException.invalidArgument("Invalid field path: unclosed backtick");
        }
        if (current.length() == 0) {
            throw FireliteException.invalidArgument("Invalid field path: trailing dot");
        }
        segments.add(current.toString());
        return new FieldPath(segments);
    }

    public List<String> segments() {
        return segments;
    }

    /**
     * Returns the value at this path, or null when any segment is absent or an
     * intermediate value is not a map.
     */
    public Value get(Map<String, Value> fields) {
        Map<String, Value> current = fields;
        for (int i = 0; i < segments.size() - 1; i++) {
            Value next = current.get(segments.get(i));
            if (!(next instanceof Value.MapValue)) {
                return null;
            }
            current = ((Value.MapValue) next).fields();
        }
        return current.get(segments.get(segments.size() - 1));
    }

    /**
     * Sets the value at this path in a mutable field map, replacing any
     * non-map intermediate value with a new map.
     */
    public void set(Map<String, Value> fields, Value value) {
        set(fields, 0, value);
    }

    private void set(Map<String, Value> fields, int index, Value value) {
        String segment = segments.get(index);
        if (index == segments.size() - 1) {
            fields.put(segment, value);
            return;
        }
        Value existing = fields.get(segment);
        Map<String, Value> child = existing instanceof Value.MapValue
                ? new LinkedHashMap<>(((Value.MapValue) existing).fields())
                : new LinkedHashMap<>();
        set(child, index + 1, value);
        fields.put(segment, new Value.MapValue(child));
    }

    /**
     * Projects {@code fields} onto the given paths. Paths with no value are
     * omitted from the result.
     */
    public static Map<String, Value> applyFieldMask(Map<String, Value> fields, List<String> paths) {
        Map<String, Value> result = new LinkedHashMap<>();
        for (String path : paths) {
            FieldPath fieldPath = parse(path);
            Value value = fieldPath.get(fields);
            if (value != null) {
                fieldPath.set(result, value);
            }
        }
        return result;
    }

    /**
     * Starts from {@code existing} and copies only the masked paths from
     * {@code update}. Masked paths absent from {@code update} leave the
     * existing value untouched.
     */
    public static Map<String, Value> applyUpdateMask(Map<String, Value> existing, Map<String, Value> update,
            List<String> mask) {
        Map<String, Value> result = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
        for (String path : mask) {
            FieldPath fieldPath = parse(path);
            Value value = fieldPath.get(update);
            if (value != null) {
                fieldPath.set(result, value);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment.contains(".") ? "`" + segment + "`" : segment);
        }
        return sb.toString();
    }
}

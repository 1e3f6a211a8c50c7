package io.firelite.core.document;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.firelite.core.value.Value;
import io.firelite.core.value.ValueEquality;

/**
 * An immutable stored document.
 */
public record Document(String name, Map<String, Value> fields, Instant createTime, Instant updateTime) {

    public Document {
        Objects.requireNonNull(name, "name");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Document withFields(Map<String, Value> newFields) {
        return new Document(name, newFields, createTime, updateTime);
    }

    /**
     * Full structural comparison used for conflict detection: both timestamps
     * plus deep field equality. Two absent documents are equal.
     */
    public static boolean sameState(Document a, Document b) {
        if (a == null || b == null) {
            return a == b;
        }
        return Objects.equals(a.updateTime, b.updateTime)
                && Objects.equals(a.createTime, b.createTime)
                && ValueEquality.fieldsEqual(a.fields, b.fields);
    }
}

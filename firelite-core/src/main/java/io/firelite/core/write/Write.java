package io.firelite.core.write;

import java.util.List;
import java.util.Objects;

import io.firelite.core.document.Document;
import io.firelite.core.document.FieldPath;

/**
 * One mutation of a commit: an update (full replace, or masked merge when
 * {@code updateMask} is set), a delete, or a transform-only write.
 */
public record Write(Operation operation, String path, Document update, List<String> updateMask,
        List<FieldTransform> transforms, Precondition precondition) {

    public enum Operation {
        UPDATE,
        DELETE,
        TRANSFORM
    }

    public Write {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(path, "path");
        updateMask = updateMask == null ? null : List.copyOf(updateMask);
        transforms = transforms == null ? List.of() : List.copyOf(transforms);
    }

    public static Write update(Document document) {
        return new Write(Operation.UPDATE, document.name(), document, null, null, null);
    }

    public static Write delete(String path) {
        return new Write(Operation.DELETE, path, null, null, null, null);
    }

    public static Write transform(String path, List<FieldTransform> transforms) {
        return new Write(Operation.TRANSFORM, path, null, null, transforms, null);
    }

    /**
     * Restricts an update to the given field paths. Each path is validated here.
     */
    public Write withUpdateMask(List<String> mask) {
        if (mask != null) {
            mask.forEach(FieldPath::parse);
        }
        return new Write(operation, path, update, mask, transforms, precondition);
    }

    public Write withTransforms(List<FieldTransform> newTransforms) {
        return new Write(operation, path, update, updateMask, newTransforms, precondition);
    }

    public Write withPrecondition(Precondition newPrecondition) {
        return new Write(operation, path, update, updateMask, transforms, newPrecondition);
    }
}

package io.firelite.core.write;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.firelite.core.document.Document;
import io.firelite.core.document.DocumentPath;
import io.firelite.core.document.FieldPath;
import io.firelite.core.storage.DocumentStore;
import io.firelite.core.value.Value;

/**
 * Validates and applies commit batches against a {@link DocumentStore}.
 *
 * <p>{@link #prepare} computes the final state of every write without
 * touching the store; {@link #apply} then writes those states and cannot
 * fail. A batch that fails in {@code prepare} leaves the store unchanged.
 * Both steps must run under the caller's commit lock.</p>
 */
public class WriteEngine {
    private static final Logger LOGGER = Logger.getLogger(WriteEngine.class.getName());

    /**
     * A validated write: the document to store, or null to delete.
     */
    public record PreparedWrite(String path, Document document, WriteResult result) {
    }

    private final DocumentStore store;

    public WriteEngine(DocumentStore store) {
        this.store = store;
    }

    /**
     * Syntactic checks that need no store access: document paths, database
     * names and update mask paths.
     */
    public void checkPaths(List<Write> writes) {
        for (Write write : writes) {
            DocumentPath.resolve(write.path());
            if (write.updateMask() != null) {
                write.updateMask().forEach(FieldPath::parse);
            }
        }
    }

    /**
     * Evaluates preconditions, masks and transforms for every write in order.
     * Every write is checked against the committed document in the store,
     * not against earlier writes of the same batch; when several writes
     * target one path the last one wins.
     */
    public List<PreparedWrite> prepare(List<Write> writes, Instant commitTime) {
        checkPaths(writes);
        List<PreparedWrite> prepared = new ArrayList<>(writes.size());
        for (Write write : writes) {
            Document current = store.get(write.path());
            if (write.precondition() != null) {
                write.precondition().check(current);
            }
            prepared.add(prepareOne(write, current, commitTime));
        }
        return prepared;
    }

    private PreparedWrite prepareOne(Write write, Document current, Instant commitTime) {
        String path = write.path();
        Instant createTime = current != null ? current.createTime() : commitTime;
        switch (write.operation()) {
            case DELETE:
                return new PreparedWrite(path, null, new WriteResult(commitTime, null));
            case UPDATE: {
                Map<String, Value> fields = write.update().fields();
                if (write.updateMask() != null) {
                    fields = FieldPath.applyUpdateMask(current == null ? null : current.fields(), fields,
                            write.updateMask());
                }
                List<Value> results = null;
                if (!write.transforms().isEmpty()) {
                    FieldTransforms.Result transformed = FieldTransforms.apply(fields, write.transforms(), commitTime);
                    fields = transformed.fields();
                    results = transformed.transformResults();
                }
                Document document = new Document(path, fields, createTime, commitTime);
                return new PreparedWrite(path, document, new WriteResult(commitTime, results));
            }
            case TRANSFORM: {
                Map<String, Value> base = current == null ? Map.of() : current.fields();
                FieldTransforms.Result transformed = FieldTransforms.apply(base, write.transforms(), commitTime);
                Document document = new Document(path, transformed.fields(), createTime, commitTime);
                return new PreparedWrite(path, document, new WriteResult(commitTime, transformed.transformResults()));
            }
            default:
                throw new IllegalStateException("Unhandled write " + write.operation());
        }
    }

    /**
     * Writes prepared states to the store in order.
     */
    public List<WriteResult> apply(List<PreparedWrite> prepared) {
        List<WriteResult> results = new ArrayList<>(prepared.size());
        for (PreparedWrite write : prepared) {
            if (write.document() == null) {
                store.delete(write.path());
            } else {
                store.set(write.path(), write.document());
            }
            results.add(write.result());
        }
        LOGGER.fine(() -> "Applied " + prepared.size() + " writes");
        return results;
    }
}

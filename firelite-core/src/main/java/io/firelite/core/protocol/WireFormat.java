package io.firelite.core.protocol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.firelite.core.document.Document;
import io.firelite.core.error.FireliteException;
import io.firelite.core.tx.TransactionOptions;
import io.firelite.core.value.Timestamps;
import io.firelite.core.value.Value;
import io.firelite.core.value.ValueCodec;
import io.firelite.core.write.FieldTransform;
import io.firelite.core.write.Precondition;
import io.firelite.core.write.Write;
import io.firelite.core.write.WriteResult;

/**
 * JSON request and response bodies of the documents API.
 */
public final class WireFormat {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private WireFormat() {
    }

    // ---- requests ----

    public static BatchGetRequest parseBatchGet(JsonNode body) {
        JsonNode documents = body.get("documents");
        if (documents != null && !documents.isNull() && !documents.isArray()) {
            throw FireliteException.invalidArgument("documents must be an array");
        }
        List<String> names = documents == null || documents.isNull() ? List.of() : textList(documents, "documents");
        List<String> mask = null;
        JsonNode maskNode = body.get("mask");
        if (maskNode != null && !maskNode.isNull()) {
            mask = fieldPaths(maskNode, "mask");
        }
        TransactionOptions newTransaction = null;
        JsonNode newTransactionNode = body.get("newTransaction");
        if (newTransactionNode != null && !newTransactionNode.isNull()) {
            newTransaction = parseTransactionOptions(newTransactionNode);
        }
        Instant readTime = optionalTimestamp(body, "readTime");
        return new BatchGetRequest(names, mask, optionalText(body, "transaction"), newTransaction, readTime);
    }

    public static CommitRequest parseCommit(JsonNode body) {
        JsonNode writesNode = body.get("writes");
        if (writesNode == null || writesNode.isNull()) {
            throw FireliteException.invalidArgument("writes is required");
        }
        if (!writesNode.isArray()) {
            throw FireliteException.invalidArgument("writes must be an array");
        }
        List<Write> writes = new ArrayList<>(writesNode.size());
        for (JsonNode node : writesNode) {
            writes.add(parseWrite(node));
        }
        return new CommitRequest(writes, optionalText(body, "transaction"));
    }

    /**
     * Parses the {@code options} of beginTransaction or the
     * {@code newTransaction} of batchGet. {@code readOnly} may be an options
     * object or a plain boolean.
     */
    public static TransactionOptions parseTransactionOptions(JsonNode options) {
        if (options == null || options.isNull()) {
            return TransactionOptions.readWrite();
        }
        if (!options.isObject()) {
            throw FireliteException.invalidArgument("transaction options must be an object");
        }
        JsonNode readOnly = options.get("readOnly");
        JsonNode readWrite = options.get("readWrite");
        boolean isReadOnly = readOnly != null && (readOnly.isObject() || readOnly.asBoolean(false));
        if (isReadOnly && readWrite != null && !readWrite.isNull()) {
            throw FireliteException.invalidArgument("readOnly and readWrite are mutually exclusive");
        }
        if (isReadOnly) {
            Instant readTime = readOnly.isObject() ? optionalTimestamp(readOnly, "readTime") : null;
            if (readTime == null) {
                readTime = optionalTimestamp(options, "readTime");
            }
            return new TransactionOptions(true, readTime, null);
        }
        String retry = readWrite != null && readWrite.isObject() ? optionalText(readWrite, "retryTransaction") : null;
        return new TransactionOptions(false, null, retry);
    }

    public static TransactionOptions parseBeginTransaction(JsonNode body) {
        return parseTransactionOptions(body.get("options"));
    }

    public static String parseRollback(JsonNode body) {
        return optionalText(body, "transaction");
    }

    public static Write parseWrite(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw FireliteException.invalidArgument("Write must be an object");
        }
        JsonNode update = node.get("update");
        JsonNode delete = node.get("delete");
        JsonNode transform = node.get("transform");
        int kinds = (present(update) ? 1 : 0) + (present(delete) ? 1 : 0) + (present(transform) ? 1 : 0);
        if (kinds != 1) {
            throw FireliteException.invalidArgument("Write must contain exactly one of update, delete or transform");
        }

        Write write;
        if (present(update)) {
            write = Write.update(parseDocument(update));
            JsonNode mask = node.get("updateMask");
            if (present(mask)) {
                write = write.withUpdateMask(fieldPaths(mask, "updateMask"));
            }
            JsonNode transforms = node.get("updateTransforms");
            if (present(transforms)) {
                write = write.withTransforms(parseFieldTransforms(transforms));
            }
        } else if (present(delete)) {
            if (!delete.isTextual()) {
                throw FireliteException.invalidArgument("delete must be a document name");
            }
            write = Write.delete(delete.textValue());
        } else {
            if (!transform.isObject()) {
                throw FireliteException.invalidArgument("transform must be an object");
            }
            String document = optionalText(transform, "document");
            if (document == null) {
                throw FireliteException.invalidArgument("transform.document is required");
            }
            JsonNode fieldTransforms = transform.get("fieldTransforms");
            write = Write.transform(document,
                    present(fieldTransforms) ? parseFieldTransforms(fieldTransforms) : List.of());
        }

        JsonNode currentDocument = node.get("currentDocument");
        if (present(currentDocument)) {
            write = write.withPrecondition(parsePrecondition(currentDocument));
        }
        return write;
    }

    static Precondition parsePrecondition(JsonNode node) {
        if (!node.isObject()) {
            throw FireliteException.invalidArgument("currentDocument must be an object");
        }
        Boolean exists = null;
        JsonNode existsNode = node.get("exists");
        if (present(existsNode)) {
            if (!existsNode.isBoolean()) {
                throw FireliteException.invalidArgument("currentDocument.exists must be a boolean");
            }
            exists = existsNode.booleanValue();
        }
        return new Precondition(exists, optionalTimestamp(node, "updateTime"));
    }

    static List<FieldTransform> parseFieldTransforms(JsonNode node) {
        if (!node.isArray()) {
            throw FireliteException.invalidArgument("field transforms must be an array");
        }
        List<FieldTransform> transforms = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            transforms.add(parseFieldTransform(item));
        }
        return transforms;
    }

    static FieldTransform parseFieldTransform(JsonNode node) {
        if (!node.isObject()) {
            throw FireliteException.invalidArgument("field transform must be an object");
        }
        String fieldPath = optionalText(node, "fieldPath");
        if (fieldPath == null) {
            throw FireliteException.invalidArgument("field transform requires fieldPath");
        }
        if (present(node.get("setToServerValue"))) {
            String serverValue = node.get("setToServerValue").asText();
            if (!"REQUEST_TIME".equals(serverValue)) {
                throw FireliteException.invalidArgument("Unsupported server value: " + serverValue);
            }
            return FieldTransform.requestTime(fieldPath);
        }
        if (present(node.get("increment"))) {
            return FieldTransform.increment(fieldPath, ValueCodec.decode(node.get("increment")));
        }
        if (present(node.get("maximum"))) {
            return FieldTransform.maximum(fieldPath, ValueCodec.decode(node.get("maximum")));
        }
        if (present(node.get("minimum"))) {
            return FieldTransform.minimum(fieldPath, ValueCodec.decode(node.get("minimum")));
        }
        if (present(node.get("appendMissingElements"))) {
            return FieldTransform.appendMissingElements(fieldPath,
                    ValueCodec.decodeArray(node.get("appendMissingElements")));
        }
        if (present(node.get("removeAllFromArray"))) {
            return FieldTransform.removeAllFromArray(fieldPath,
                    ValueCodec.decodeArray(node.get("removeAllFromArray")));
        }
        throw FireliteException.invalidArgument("field transform for " + fieldPath + " has no operation");
    }

    /**
     * Parses a document body. Timestamps are ignored; the server assigns them.
     */
    public static Document parseDocument(JsonNode node) {
        if (!node.isObject()) {
            throw FireliteException.invalidArgument("update must be a document object");
        }
        String name = optionalText(node, "name");
        if (name == null) {
            throw FireliteException.invalidArgument("update.name is required");
        }
        return new Document(name, ValueCodec.decodeFields(node.get("fields")), null, null);
    }

    // ---- responses ----

    public static ObjectNode writeDocument(Document document) {
        ObjectNode node = NODES.objectNode();
        node.put("name", document.name());
        node.set("fields", ValueCodec.encodeFields(document.fields()));
        if (document.createTime() != null) {
            node.put("createTime", Timestamps.format(document.createTime()));
        }
        if (document.updateTime() != null) {
            node.put("updateTime", Timestamps.format(document.updateTime()));
        }
        return node;
    }

    public static ArrayNode writeBatchGet(List<BatchGetResult> results) {
        ArrayNode array = NODES.arrayNode();
        for (BatchGetResult result : results) {
            ObjectNode item = array.addObject();
            if (result.isFound()) {
                item.set("found", writeDocument(result.found()));
            } else {
                item.put("missing", result.missing());
            }
            item.put("readTime", Timestamps.format(result.readTime()));
            if (result.transaction() != null) {
                item.put("transaction", result.transaction());
            }
        }
        return array;
    }

    public static ObjectNode writeCommit(CommitResponse response) {
        ObjectNode node = NODES.objectNode();
        ArrayNode results = node.putArray("writeResults");
        for (WriteResult result : response.writeResults()) {
            ObjectNode item = results.addObject();
            item.put("updateTime", Timestamps.format(result.updateTime()));
            if (result.transformResults() != null) {
                ArrayNode values = item.putArray("transformResults");
                for (Value value : result.transformResults()) {
                    values.add(ValueCodec.encode(value));
                }
            }
        }
        node.put("commitTime", Timestamps.format(response.commitTime()));
        return node;
    }

    public static ObjectNode writeBeginTransaction(String transactionId) {
        ObjectNode node = NODES.objectNode();
        node.put("transaction", transactionId);
        return node;
    }

    public static ObjectNode writeError(FireliteException error) {
        ObjectNode node = NODES.objectNode();
        ObjectNode body = node.putObject("error");
        body.put("code", error.getStatus().httpCode());
        body.put("message", error.getMessage());
        body.put("status", error.getStatus().name());
        return node;
    }

    // ---- helpers ----

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!present(value)) {
            return null;
        }
        if (!value.isTextual()) {
            throw FireliteException.invalidArgument(field + " must be a string");
        }
        return value.textValue();
    }

    private static Instant optionalTimestamp(JsonNode node, String field) {
        String text = optionalText(node, field);
        return text == null ? null : Timestamps.parse(text);
    }

    private static List<String> fieldPaths(JsonNode mask, String name) {
        JsonNode paths = mask.get("fieldPaths");
        if (!present(paths)) {
            return List.of();
        }
        if (!paths.isArray()) {
            throw FireliteException.invalidArgument(name + ".fieldPaths must be an array");
        }
        return textList(paths, name + ".fieldPaths");
    }

    private static List<String> textList(JsonNode array, String name) {
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw FireliteException.invalidArgument(name + " must contain only strings");
            }
            values.add(item.textValue());
        }
        return values;
    }
}

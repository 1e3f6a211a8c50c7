package io.firelite.core.protocol;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.firelite.core.error.ErrorStatus;
import io.firelite.core.error.FireliteException;

/**
 * Dispatches JSON calls of the documents API to {@link DocumentHandlers} and
 * renders every outcome, errors included, as a {@link ProtocolResponse}.
 */
public class DocumentsApi {
    private static final Logger LOGGER = Logger.getLogger(DocumentsApi.class.getName());

    private final DocumentHandlers handlers;
    private final ObjectMapper mapper = new ObjectMapper();

    public DocumentsApi(DocumentHandlers handlers) {
        this.handlers = handlers;
    }

    /**
     * @param action one of {@code batchGet}, {@code commit},
     *               {@code beginTransaction}, {@code rollback}
     * @param body   raw request body; blank means {@code {}}
     */
    public ProtocolResponse handle(String action, String body) {
        JsonNode json;
        try {
            json = body == null || body.isBlank() ? JsonNodeFactory.instance.objectNode() : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return error(FireliteException.invalidArgument("Invalid JSON body: " + e.getOriginalMessage()));
        }
        return handle(action, json);
    }

    public ProtocolResponse handle(String action, JsonNode body) {
        try {
            if (body == null || !body.isObject()) {
                throw FireliteException.invalidArgument("Request body must be a JSON object");
            }
            switch (action) {
                case "batchGet":
                    return ok(WireFormat.writeBatchGet(handlers.batchGet(WireFormat.parseBatchGet(body))));
                case "commit":
                    return ok(WireFormat.writeCommit(handlers.commit(parseCommit(body))));
                case "beginTransaction":
                    return ok(WireFormat.writeBeginTransaction(
                            handlers.beginTransaction(WireFormat.parseBeginTransaction(body))));
                case "rollback":
                    handlers.rollback(WireFormat.parseRollback(body));
                    return ok(JsonNodeFactory.instance.objectNode());
                default:
                    throw FireliteException.notFound("Unknown action: " + action);
            }
        } catch (FireliteException e) {
            LOGGER.fine(() -> action + " failed: " + e.getStatus() + " " + e.getMessage());
            return error(e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unexpected error in " + action, e);
            String message = e.getMessage() != null ? e.getMessage() : "Internal error";
            return error(new FireliteException(ErrorStatus.INTERNAL, message, e));
        }
    }

    private CommitRequest parseCommit(JsonNode body) {
        try {
            return WireFormat.parseCommit(body);
        } catch (RuntimeException e) {
            JsonNode transaction = body.get("transaction");
            if (transaction != null && transaction.isTextual()) {
                handlers.abandon(transaction.asText());
            }
            throw e;
        }
    }

    public static ProtocolResponse error(FireliteException e) {
        return new ProtocolResponse(e.getStatus().httpCode(), WireFormat.writeError(e));
    }

    private static ProtocolResponse ok(JsonNode body) {
        return new ProtocolResponse(200, body);
    }
}

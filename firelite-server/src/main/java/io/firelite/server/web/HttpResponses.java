package io.firelite.server.web;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.firelite.core.error.ErrorStatus;
import io.firelite.core.error.FireliteException;
import io.firelite.core.protocol.DocumentsApi;
import io.firelite.core.protocol.ProtocolResponse;
import io.helidon.webserver.ServerResponse;

/**
 * Writes {@link ProtocolResponse}s to Helidon responses.
 */
final class HttpResponses {
    private static final Logger LOGGER = Logger.getLogger(HttpResponses.class.getName());

    private HttpResponses() {
    }

    static void send(ServerResponse res, ProtocolResponse response) {
        res.status(response.status());
        res.headers().add("Content-Type", "application/json");
        res.send(response.body().toString());
    }

    static void sendError(ServerResponse res, FireliteException error) {
        send(res, DocumentsApi.error(error));
    }

    /**
     * Used when reading the request body itself fails.
     */
    static Void sendFailure(ServerResponse res, Throwable t) {
        LOGGER.log(Level.SEVERE, "Failed to read request", t);
        sendError(res, new FireliteException(ErrorStatus.INTERNAL, "Failed to read request body", t));
        return null;
    }
}

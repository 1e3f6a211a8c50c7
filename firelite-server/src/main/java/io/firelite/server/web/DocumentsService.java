package io.firelite.server.web;

import io.firelite.core.document.DocumentPath;
import io.firelite.core.error.FireliteException;
import io.firelite.core.protocol.DocumentsApi;
import io.firelite.core.protocol.ProtocolResponse;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.Service;

/**
 * REST surface of the documents API:
 * {@code POST /projects/{project}/databases/{database}/documents:{action}}.
 */
public class DocumentsService implements Service {
    private static final String ACTION_PREFIX = "documents:";

    private final DocumentsApi api;

    public DocumentsService(DocumentsApi api) {
        this.api = api;
    }

    @Override
    public void update(Routing.Rules rules) {
        rules.post("/projects/{project}/databases/{database}/{action}", this::documents);
    }

    private void documents(ServerRequest req, ServerResponse res) {
        String database = req.path().param("database");
        String action = req.path().param("action");
        req.content().as(String.class)
                .thenAccept(body -> HttpResponses.send(res, dispatch(database, action, body)))
                .exceptionally(t -> HttpResponses.sendFailure(res, t));
    }

    ProtocolResponse dispatch(String database, String action, String body) {
        if (action == null || !action.startsWith(ACTION_PREFIX)) {
            return DocumentsApi.error(FireliteException.notFound("Unknown method: " + action));
        }
        try {
            DocumentPath.checkDatabase(database);
        } catch (FireliteException e) {
            return DocumentsApi.error(e);
        }
        return api.handle(action.substring(ACTION_PREFIX.length()), body);
    }
}

package io.firelite.server.web;

import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.firelite.core.Engine;
import io.firelite.core.document.DocumentPath;
import io.firelite.core.error.ErrorStatus;
import io.firelite.core.error.FireliteException;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.Service;

/**
 * Emulator housekeeping: status report and wiping all documents.
 */
public class EmulatorService implements Service {
    private static final Logger LOGGER = Logger.getLogger(EmulatorService.class.getName());

    public record StatusResponse(String status, String uptime, int documents, int activeTransactions) {
    }

    private final Engine engine;
    private final ObjectMapper mapper = new ObjectMapper();

    public EmulatorService(Engine engine) {
        this.engine = engine;
    }

    @Override
    public void update(Routing.Rules rules) {
        rules.get("/status", this::status);
        rules.delete("/emulator/v1/projects/{project}/databases/{database}/documents", this::clear);
    }

    private void status(ServerRequest req, ServerResponse res) {
        long uptime = engine.getClock().millis() - engine.getStartTime().toEpochMilli();
        StatusResponse status = new StatusResponse("ok", formatUptime(uptime), engine.getStore().size(),
                engine.getTransactionManager().activeCount());
        try {
            res.headers().add("Content-Type", "application/json");
            res.send(mapper.writeValueAsString(status));
        } catch (JsonProcessingException e) {
            HttpResponses.sendError(res, new FireliteException(ErrorStatus.INTERNAL, e.getMessage(), e));
        }
    }

    private void clear(ServerRequest req, ServerResponse res) {
        try {
            DocumentPath.checkDatabase(req.path().param("database"));
        } catch (FireliteException e) {
            HttpResponses.sendError(res, e);
            return;
        }
        LOGGER.info(() -> "Clearing documents of project " + req.path().param("project"));
        engine.clear();
        res.headers().add("Content-Type", "application/json");
        res.send("{}");
    }

    static String formatUptime(long millis) {
        long seconds = millis / 1000;
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        return String.format("%dh %dm %ds", hours, minutes, secs);
    }
}

package io.firelite.server;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import io.firelite.core.Engine;
import io.firelite.core.protocol.DocumentHandlers;
import io.firelite.core.protocol.DocumentsApi;
import io.firelite.core.storage.InMemoryDocumentStore;
import io.firelite.server.config.EmulatorConfig;
import io.firelite.server.web.DocumentsService;
import io.firelite.server.web.EmulatorService;
import io.helidon.webserver.Routing;
import io.helidon.webserver.WebServer;

/**
 * The emulator's HTTP server: one {@link Engine} behind a Helidon web server.
 */
public class FireliteServer {
    private static final Logger LOGGER = Logger.getLogger(FireliteServer.class.getName());
    private static final long STARTUP_TIMEOUT_SECONDS = 10;

    private final EmulatorConfig config;
    private final Engine engine;
    private WebServer server;

    public FireliteServer(EmulatorConfig config) {
        this(config, new Engine(new InMemoryDocumentStore(), Clock.systemUTC(),
                Duration.ofMillis(config.getTransactionTimeoutMs())));
    }

    public FireliteServer(EmulatorConfig config, Engine engine) {
        this.config = config;
        this.engine = engine;
    }

    static Routing routing(Engine engine) {
        DocumentsApi api = new DocumentsApi(new DocumentHandlers(engine));
        return Routing.builder()
                .register("/v1", new DocumentsService(api))
                .register(new EmulatorService(engine))
                .build();
    }

    /**
     * Starts the server and blocks until it is listening. A configured port
     * of 0 binds an ephemeral port; see {@link #port()}.
     */
    public FireliteServer start() {
        server = WebServer.builder()
                .host(config.getHost())
                .port(config.getPort())
                .routing(routing(engine))
                .build();
        server.start().await(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        LOGGER.info(() -> "Firelite emulator started at http://" + config.getHost() + ":" + server.port());
        return this;
    }

    public void stop() {
        if (server != null) {
            server.shutdown().await(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOGGER.info("Firelite emulator stopped");
            server = null;
        }
    }

    public int port() {
        if (server == null) {
            throw new IllegalStateException("Server is not running");
        }
        return server.port();
    }

    public Engine getEngine() {
        return engine;
    }
}

package io.firelite.server.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.firelite.server.FireliteServer;
import io.firelite.server.config.EmulatorConfig;

class DocumentsServiceTest {
    private static final String DB = "projects/demo/databases/(default)";
    private static final String U1 = DB + "/documents/users/u1";

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private FireliteServer server;

    @BeforeEach
    void start() {
        EmulatorConfig config = EmulatorConfig.defaultConfig();
        config.setHost("localhost");
        config.setPort(0);
        server = new FireliteServer(config).start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.port() + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String path) throws IOException, InterruptedException {
        return client.send(builder.uri(URI.create("http://localhost:" + server.port() + path)).build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void commitAndBatchGetOverHttp() throws Exception {
        HttpResponse<String> commit = post("/v1/" + DB + "/documents:commit", "{\"writes\":[{\"update\":{\"name\":\""
                + U1 + "\",\"fields\":{\"n\":{\"integerValue\":\"1\"}}}}]}");
        assertThat(commit.statusCode()).isEqualTo(200);
        assertThat(commit.headers().firstValue("Content-Type")).hasValueSatisfying(
                v -> assertThat(v).startsWith("application/json"));

        HttpResponse<String> get = post("/v1/" + DB + "/documents:batchGet", "{\"documents\":[\"" + U1 + "\"]}");
        JsonNode body = mapper.readTree(get.body());
        assertThat(body.get(0).get("found").get("fields").get("n").get("integerValue").asText()).isEqualTo("1");
    }

    @Test
    void transactionConflictIs409() throws Exception {
        String tx = mapper.readTree(post("/v1/" + DB + "/documents:beginTransaction", "{}").body())
                .get("transaction").asText();
        post("/v1/" + DB + "/documents:batchGet", "{\"documents\":[\"" + U1 + "\"],\"transaction\":\"" + tx + "\"}");
        post("/v1/" + DB + "/documents:commit", "{\"writes\":[{\"update\":{\"name\":\"" + U1 + "\",\"fields\":{}}}]}");

        HttpResponse<String> commit = post("/v1/" + DB + "/documents:commit",
                "{\"writes\":[{\"update\":{\"name\":\"" + U1 + "\",\"fields\":{}}}],\"transaction\":\"" + tx + "\"}");
        assertThat(commit.statusCode()).isEqualTo(409);
        assertThat(mapper.readTree(commit.body()).get("error").get("status").asText()).isEqualTo("ABORTED");
    }

    @Test
    void unknownDatabaseAndMethodAreNotFound() throws Exception {
        assertThat(post("/v1/projects/demo/databases/other/documents:commit", "{\"writes\":[]}").statusCode())
                .isEqualTo(404);
        assertThat(post("/v1/" + DB + "/documents:listen", "{}").statusCode()).isEqualTo(404);
    }

    @Test
    void statusAndClear() throws Exception {
        post("/v1/" + DB + "/documents:commit", "{\"writes\":[{\"update\":{\"name\":\"" + U1 + "\",\"fields\":{}}}]}");
        JsonNode status = mapper.readTree(send(HttpRequest.newBuilder().GET(), "/status").body());
        assertThat(status.get("documents").asInt()).isEqualTo(1);

        HttpResponse<String> clear = send(HttpRequest.newBuilder().DELETE(), "/emulator/v1/" + DB + "/documents");
        assertThat(clear.statusCode()).isEqualTo(200);
        assertThat(server.getEngine().getStore().size()).isZero();
    }

    @Test
    void formatsUptime() {
        assertThat(EmulatorService.formatUptime(3_723_000)).isEqualTo("1h 2m 3s");
    }
}

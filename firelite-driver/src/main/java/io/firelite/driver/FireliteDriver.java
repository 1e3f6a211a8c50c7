package io.firelite.driver;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.firelite.core.value.NativeValues;
import io.firelite.core.value.ValueCodec;

/**
 * Network driver for the Firelite emulator's documents API.
 *
 * <p>Document paths passed to convenience methods are relative to the
 * database root, e.g. {@code users/alice}.</p>
 */
public class FireliteDriver {
    private static final Logger LOGGER = Logger.getLogger(FireliteDriver.class.getName());
    private static final String DATABASE = "(default)";

    private final String baseUrl;
    private final String projectId;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final NativeValues nativeValues;

    public FireliteDriver(String host, int port, String projectId) {
        this.baseUrl = "http://" + host + ":" + port;
        this.projectId = projectId;
        this.httpClient = HttpClient.newHttpClient();
        this.mapper = new ObjectMapper();
        this.nativeValues = new NativeValues(projectId, DATABASE);
    }

    public String databaseName() {
        return "projects/" + projectId + "/databases/" + DATABASE;
    }

    public String documentName(String relativePath) {
        return databaseName() + "/documents/" + relativePath;
    }

    // Protocol operations

    public String beginTransaction(boolean readOnly) {
        ObjectNode body = mapper.createObjectNode();
        body.putObject("options").putObject(readOnly ? "readOnly" : "readWrite");
        return call("beginTransaction", body).get("transaction").asText();
    }

    public String beginTransaction() {
        return beginTransaction(false);
    }

    /**
     * @param names       full document names
     * @param transaction transaction id, or null to read the live store
     */
    public ArrayNode batchGet(List<String> names, String transaction) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode documents = body.putArray("documents");
        names.forEach(documents::add);
        if (transaction != null) {
            body.put("transaction", transaction);
        }
        return (ArrayNode) call("batchGet", body);
    }

    /**
     * Sends wire-format writes, built with {@link #updateWrite} and
     * {@link #deleteWrite} or by hand.
     */
    public JsonNode commit(List<ObjectNode> writes, String transaction) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode array = body.putArray("writes");
        writes.forEach(array::add);
        if (transaction != null) {
            body.put("transaction", transaction);
        }
        return call("commit", body);
    }

    public void rollback(String transaction) {
        ObjectNode body = mapper.createObjectNode();
        body.put("transaction", transaction);
        call("rollback", body);
    }

    // Write builders

    public ObjectNode updateWrite(String relativePath, Map<String, ?> fields) {
        ObjectNode write = mapper.createObjectNode();
        ObjectNode update = write.putObject("update");
        update.put("name", documentName(relativePath));
        update.set("fields", ValueCodec.encodeFields(nativeValues.encodeFields(fields)));
        return write;
    }

    public ObjectNode deleteWrite(String relativePath) {
        ObjectNode write = mapper.createObjectNode();
        write.put("delete", documentName(relativePath));
        return write;
    }

    // Native convenience

    public void set(String relativePath, Map<String, ?> fields) {
        commit(List.of(updateWrite(relativePath, fields)), null);
    }

    public void delete(String relativePath) {
        commit(List.of(deleteWrite(relativePath)), null);
    }

    /**
     * Returns the document's fields as native values, or null when it does
     * not exist.
     */
    public Map<String, Object> get(String relativePath) {
        return get(relativePath, null);
    }

    public Map<String, Object> get(String relativePath, String transaction) {
        JsonNode entry = batchGet(List.of(documentName(relativePath)), transaction).get(0);
        JsonNode found = entry.get("found");
        if (found == null || found.isNull()) {
            return null;
        }
        return NativeValues.decodeFields(ValueCodec.decodeFields(found.get("fields")), false);
    }

    // Emulator housekeeping

    public void clear() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/emulator/v1/" + databaseName() + "/documents"))
                .DELETE()
                .build();
        send(request);
    }

    public Map<String, Object> status() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/status"))
                .GET()
                .build();
        try {
            return mapper.readValue(send(request), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new DriverException("Invalid status response", e);
        }
    }

    private JsonNode call(String action, ObjectNode body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/" + databaseName() + "/documents:" + action))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        try {
            return mapper.readTree(send(request));
        } catch (IOException e) {
            throw new DriverException("Invalid " + action + " response", e);
        }
    }

    private String send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DriverException("Communication error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Interrupted", e);
        }
        if (response.statusCode() >= 200 && response.statusCode() < 300) {
            return response.body();
        }
        LOGGER.fine(() -> "Request " + request.uri() + " failed: " + response.statusCode());
        throw toException(response);
    }

    private DriverException toException(HttpResponse<String> response) {
        String message = response.body();
        String status = null;
        try {
            JsonNode error = mapper.readTree(response.body()).get("error");
            if (error != null) {
                message = error.path("message").asText(message);
                status = error.path("status").asText(null);
            }
        } catch (IOException e) {
            LOGGER.fine(() -> "Non-JSON error body: " + e.getMessage());
        }
        return new DriverException("Request failed: " + response.statusCode() + " - " + message,
                response.statusCode(), status);
    }
}

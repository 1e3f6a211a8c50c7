package io.firelite.server.config;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Configuration for the Firelite emulator, read from a JSON file.
 */
public class EmulatorConfig {
    private static final Logger LOGGER = Logger.getLogger(EmulatorConfig.class.getName());

    public static final String DEFAULT_FILE = "firelite.json";

    private String host = "0.0.0.0";
    private int port = 8080;
    private long transactionTimeoutMs = 60_000;

    public static EmulatorConfig defaultConfig() {
        return new EmulatorConfig();
    }

    /**
     * Reads {@code filePath}. A missing or unreadable file yields defaults.
     * Both root-level keys ({@code Host}, {@code Port},
     * {@code TransactionTimeoutMs}) and the nested
     * {@code server}/{@code transactions} form are accepted.
     */
    public static EmulatorConfig loadFromFile(String filePath) {
        ObjectMapper mapper = new ObjectMapper();
        EmulatorConfig config = new EmulatorConfig();
        File file = new File(filePath);
        if (!file.exists()) {
            LOGGER.info(() -> "Config file not found: " + filePath + ". Using defaults.");
            return config;
        }

        try {
            JsonNode root = mapper.readTree(file);

            if (root.has("Host")) config.host = root.get("Host").asText();
            if (root.has("Port")) config.port = root.get("Port").asInt();
            if (root.has("TransactionTimeoutMs")) config.transactionTimeoutMs = root.get("TransactionTimeoutMs").asLong();

            // Nested form
            if (root.has("server")) {
                JsonNode server = root.get("server");
                if (server.has("host")) config.host = server.get("host").asText();
                if (server.has("port")) config.port = server.get("port").asInt();
            }
            if (root.has("transactions")) {
                JsonNode transactions = root.get("transactions");
                if (transactions.has("timeout_ms")) config.transactionTimeoutMs = transactions.get("timeout_ms").asLong();
            }
        } catch (IOException e) {
            LOGGER.warning(() -> "Failed to load config file: " + e.getMessage());
        }
        if (config.transactionTimeoutMs <= 0) {
            LOGGER.warning(() -> "Ignoring non-positive TransactionTimeoutMs " + config.transactionTimeoutMs);
            config.transactionTimeoutMs = 60_000;
        }
        return config;
    }

    public void saveToFile(String filePath) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("Host", host);
            data.put("Port", port);
            data.put("TransactionTimeoutMs", transactionTimeoutMs);

            mapper.writerWithDefaultPrettyPrinter().writeValue(new File(filePath), data);
            LOGGER.info(() -> "Configuration saved to " + filePath);
        } catch (IOException e) {
            LOGGER.warning(() -> "Failed to save config file: " + e.getMessage());
        }
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public long getTransactionTimeoutMs() { return transactionTimeoutMs; }
    public void setTransactionTimeoutMs(long transactionTimeoutMs) { this.transactionTimeoutMs = transactionTimeoutMs; }
}

package io.firelite.server;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

import io.firelite.server.config.EmulatorConfig;
import io.helidon.common.LogConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "firelite", mixinStandardHelpOptions = true, version = "1.0",
         description = "Starts the Firelite document database emulator")
public class Main implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = EmulatorConfig.DEFAULT_FILE)
    private String configPath;

    @Option(names = {"-H", "--host"}, description = "Overrides the configured host")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Overrides the configured port")
    private Integer port;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() {
        System.out.println("""
                  _____ _          _ _ _
                 |  ___(_)_ __ ___| (_) |_ ___
                 | |_  | | '__/ _ \\ | | __/ _ \\
                 |  _| | | | |  __/ | | ||  __/
                 |_|   |_|_|  \\___|_|_|\\__\\___|
                 Firelite Emulator v1.0
                """);

        LogConfig.configureRuntime();

        File configFile = new File(configPath);
        LOGGER.info("Using config file: " + configFile.getAbsolutePath());
        EmulatorConfig config = EmulatorConfig.loadFromFile(configPath);
        if (!configFile.exists()) {
            config.saveToFile(configPath);
            LOGGER.info("Created default " + configPath);
        }
        if (host != null) {
            config.setHost(host);
        }
        if (port != null) {
            config.setPort(port);
        }

        FireliteServer server = new FireliteServer(config).start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        return 0;
    }
}

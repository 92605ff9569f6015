package eu.nurkert.depSync;

import eu.nurkert.depSync.command.DependencySyncCommand;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

public final class DependencySync {

    private DependencySync() {
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new DependencySyncCommand()).execute(args);
        System.exit(exitCode);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = DependencySync.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }
}

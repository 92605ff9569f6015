package eu.nurkert.depSync.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The versions file to compare against does not exist. Nothing can be checked without it.
 */
public class ConfigFileNotFoundException extends IOException {

    private final Path path;

    public ConfigFileNotFoundException(Path path, Throwable cause) {
        super("Versions file not found: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

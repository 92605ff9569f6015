package eu.nurkert.depSync.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link SyncSettings}: the bundled {@code dependency-sync.yml} first, then an
 * optional file of the same name that overrides individual entries.
 */
public class SettingsLoader {

    public static final String SETTINGS_FILE_NAME = "dependency-sync.yml";

    private static final Logger LOGGER = Logger.getLogger(SettingsLoader.class.getName());

    private final ObjectMapper mapper;

    public SettingsLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @param overrideFile optional user file; ignored when {@code null} or absent
     * @throws IOException if a present settings file is not valid YAML
     */
    public SyncSettings load(Path overrideFile) throws IOException {
        ObjectNode merged = mapper.createObjectNode();

        try (InputStream bundled = SettingsLoader.class.getClassLoader().getResourceAsStream(SETTINGS_FILE_NAME)) {
            if (bundled != null) {
                merge(merged, mapper.readTree(bundled));
            } else {
                LOGGER.log(Level.FINE, "No bundled {0} on the classpath; using built-in defaults", SETTINGS_FILE_NAME);
            }
        }

        if (overrideFile != null && Files.isRegularFile(overrideFile)) {
            try (InputStream override = Files.newInputStream(overrideFile)) {
                merge(merged, mapper.readTree(override));
            }
            LOGGER.log(Level.FINE, "Applied settings overrides from {0}", overrideFile.toAbsolutePath());
        }

        if (merged.isEmpty()) {
            return SyncSettings.defaults();
        }
        return mapper.treeToValue(merged, SyncSettings.class);
    }

    private static void merge(ObjectNode target, JsonNode source) {
        if (source == null || !source.isObject()) {
            return;
        }
        source.fields().forEachRemaining(entry -> {
            JsonNode existing = target.get(entry.getKey());
            if (existing instanceof ObjectNode existingObject && entry.getValue().isObject()) {
                merge(existingObject, entry.getValue());
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
        });
    }
}

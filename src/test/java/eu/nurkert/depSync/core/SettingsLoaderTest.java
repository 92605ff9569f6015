package eu.nurkert.depSync.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsLoaderTest {

    private final SettingsLoader loader = new SettingsLoader();

    @Test
    void loadsBundledDefaults() throws Exception {
        SyncSettings settings = loader.load(null);

        assertEquals("versions.properties", settings.versionsFile());
        assertEquals("GITHUB_OUTPUT", settings.githubOutputEnv());
        assertEquals(List.of("GITHUB_TOKEN", "GH_TOKEN"), settings.tokenEnv());
        assertEquals(100, settings.tagPageSize());
        assertEquals(2, settings.githubMaxPages());
        assertEquals(0, settings.maxConcurrency());
        assertEquals(5, settings.http().connectTimeoutSeconds());
        assertEquals(10, settings.http().requestTimeoutSeconds());
        assertEquals(3, settings.retry().attempts());
        assertEquals(1000L, settings.retry().baseDelayMillis());
        assertEquals("https://api.github.com", settings.api().github());
        assertEquals(3, settings.retryPolicy().getMaxAttempts());
    }

    @Test
    void overrideFileReplacesOnlyGivenEntries(@TempDir Path tempDir) throws Exception {
        Path override = tempDir.resolve(SettingsLoader.SETTINGS_FILE_NAME);
        Files.writeString(override, """
                versionsFile: build/versions.properties
                retry:
                  attempts: 5
                api:
                  github: http://localhost:8080
                """);

        SyncSettings settings = loader.load(override);

        assertEquals("build/versions.properties", settings.versionsFile());
        assertEquals(5, settings.retry().attempts());
        assertEquals(1000L, settings.retry().baseDelayMillis());
        assertEquals("http://localhost:8080", settings.api().github());
        assertEquals("https://api.bitbucket.org", settings.api().bitbucket());
    }

    @Test
    void absentOverrideFileIsIgnored(@TempDir Path tempDir) throws Exception {
        SyncSettings settings = loader.load(tempDir.resolve("missing.yml"));

        assertEquals(SyncSettings.defaults(), settings);
    }

    @Test
    void invalidYamlIsAnError(@TempDir Path tempDir) throws Exception {
        Path override = tempDir.resolve("broken.yml");
        Files.writeString(override, "retry: [unclosed\n");

        assertThrows(IOException.class, () -> loader.load(override));
    }

    @Test
    void defaultsFillMissingValues() {
        SyncSettings settings = new SyncSettings(" ", null, null, null, -1, 0, -3, null, null, null);

        assertEquals(SyncSettings.DEFAULT_VERSIONS_FILE, settings.versionsFile());
        assertEquals(100, settings.tagPageSize());
        assertEquals(2, settings.githubMaxPages());
        assertEquals(0, settings.maxConcurrency());
        assertEquals(300, settings.http().downloadTimeoutSeconds());
    }
}

package eu.nurkert.depSync.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class VersionsFileRepositoryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-30T23:00:00Z"), ZoneOffset.UTC);

    private final VersionsFileRepository repository = new VersionsFileRepository(CLOCK);

    @Test
    void parsesKeyValuePairsInFileOrder(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, """
                # FFmpeg build dependencies
                # Updated: 2025-01-15

                FFMPEG_VERSION=n8.0.1
                  OPUS_VERSION = 1.5.2\t
                not a pair
                =orphan
                DAV1D_URL=https://example.com/dav1d?a=b&c=d
                """);

        Map<String, String> values = repository.parse(file);

        assertEquals(List.of("FFMPEG_VERSION", "OPUS_VERSION", "DAV1D_URL"), List.copyOf(values.keySet()));
        assertEquals("n8.0.1", values.get("FFMPEG_VERSION"));
        assertEquals("1.5.2", values.get("OPUS_VERSION"));
        assertEquals("https://example.com/dav1d?a=b&c=d", values.get("DAV1D_URL"));
    }

    @Test
    void lastDuplicateKeyWins(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "LAME_VERSION=3.99\nLAME_VERSION=3.100\n");

        assertEquals("3.100", repository.parse(file).get("LAME_VERSION"));
    }

    @Test
    void writeChangesOnlyTargetedLinesAndTimestamp(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, """
                # FFmpeg build dependencies
                # Updated: 2025-01-15

                # Video
                FFMPEG_VERSION=n8.0
                \tOPUS_VERSION=1.5.1
                OPUS_SHA256=aaa
                LAME_VERSION=3.100
                """);

        Map<String, String> updates = new LinkedHashMap<>();
        updates.put("FFMPEG_VERSION", "n8.0.1");
        updates.put("OPUS_VERSION", "1.5.2");
        repository.write(file, updates);

        assertEquals("""
                # FFmpeg build dependencies
                # Updated: 2025-06-30

                # Video
                FFMPEG_VERSION=n8.0.1
                \tOPUS_VERSION=1.5.2
                OPUS_SHA256=aaa
                LAME_VERSION=3.100
                """, Files.readString(file));
    }

    @Test
    void writeRewritesEveryOccurrenceOfADuplicateKey(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "OGG_VERSION=1.3.4\n# again\nOGG_VERSION=1.3.4\n");

        repository.write(file, Map.of("OGG_VERSION", "1.3.5"));

        assertEquals("OGG_VERSION=1.3.5\n# again\nOGG_VERSION=1.3.5\n", Files.readString(file));
    }

    @Test
    void unknownKeysAreNotAppended(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "FLAC_VERSION=1.4.3\n");

        repository.write(file, Map.of("SPEEX_VERSION", "1.2.1"));

        assertEquals("FLAC_VERSION=1.4.3\n", Files.readString(file));
    }

    @Test
    void preservesCrLfAndMissingFinalNewline(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "# Updated: 2024-12-01\r\nX265_VERSION=3.6\r\nNASM_VERSION=2.16.03");

        repository.write(file, Map.of("NASM_VERSION", "2.16.3"));

        assertEquals("# Updated: 2025-06-30\r\nX265_VERSION=3.6\r\nNASM_VERSION=2.16.3", Files.readString(file));
    }

    @Test
    void writeWithoutChangesKeepsContentExceptTimestamp(@TempDir Path tempDir) throws Exception {
        String content = "# header\n\n  # indented comment\nweird line\nKEY=a=b\n";
        Path file = write(tempDir, content);

        repository.write(file, Map.of());

        assertEquals(content, Files.readString(file));
    }

    @Test
    void missingFileIsReported(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("versions.properties");

        ConfigFileNotFoundException exception = assertThrows(ConfigFileNotFoundException.class,
                () -> repository.parse(missing));

        assertEquals(missing, exception.getPath());
        assertFalse(Files.exists(missing));
    }

    @Test
    void extractsMetadata(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "# Updated: 2025-01-15\nFFMPEG_VERSION=n8.0.1\n");

        VersionsMetadata metadata = repository.metadata(file);

        assertEquals("2025-01-15", metadata.lastUpdated());
        assertEquals("8.0.1", metadata.ffmpegVersion());
    }

    @Test
    void metadataFallsBackToTodayAndUnknown(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "OPUS_VERSION=1.5.2\n");

        VersionsMetadata metadata = repository.metadata(file);

        assertEquals("2025-06-30", metadata.lastUpdated());
        assertEquals(VersionsMetadata.UNKNOWN, metadata.ffmpegVersion());
    }

    @Test
    void metadataIgnoresFfmpegVersionWithoutReleasePrefix(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "# Updated: 2025-01-15\nFFMPEG_VERSION=master\n");

        assertEquals(VersionsMetadata.UNKNOWN, repository.metadata(file).ffmpegVersion());
    }

    @Test
    void writeKeepsFilePermissions(@TempDir Path tempDir) throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path file = write(tempDir, "FFMPEG_VERSION=n8.0\n");
        Set<PosixFilePermission> permissions = PosixFilePermissions.fromString("rw-r--r--");
        Files.setPosixFilePermissions(file, permissions);

        repository.write(file, Map.of("FFMPEG_VERSION", "n8.0.1"));

        assertEquals(permissions, Files.getPosixFilePermissions(file));
        assertEquals("FFMPEG_VERSION=n8.0.1\n", Files.readString(file));
    }

    @Test
    void writeThroughSymlinkUpdatesLinkedFile(@TempDir Path tempDir) throws Exception {
        Path realDir = Files.createDirectory(tempDir.resolve("shared"));
        Path real = write(realDir, "OPUS_VERSION=1.5.1\n");
        Path link = tempDir.resolve("versions.properties");
        try {
            Files.createSymbolicLink(link, real);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not available: " + e.getMessage());
        }

        repository.write(link, Map.of("OPUS_VERSION", "1.5.2"));

        assertTrue(Files.isSymbolicLink(link));
        assertEquals("OPUS_VERSION=1.5.2\n", Files.readString(real));
        try (Stream<Path> entries = Files.list(realDir)) {
            assertEquals(List.of(real.getFileName()), entries.map(Path::getFileName).toList());
        }
    }

    @Test
    void leavesNoTemporaryFilesBehind(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "FFMPEG_VERSION=n8.0\n");

        repository.write(file, Map.of("FFMPEG_VERSION", "n8.0.1"));

        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(List.of(file.getFileName()), entries.map(Path::getFileName).toList());
        }
        assertTrue(Files.readString(file).startsWith("FFMPEG_VERSION=n8.0.1"));
    }

    private static Path write(Path dir, String content) throws Exception {
        Path file = dir.resolve("versions.properties");
        Files.writeString(file, content);
        return file;
    }
}

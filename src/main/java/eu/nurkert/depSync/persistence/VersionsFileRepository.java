package eu.nurkert.depSync.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and rewrites the {@code versions.properties} file that pins every dependency.
 *
 * <p>The file format is line oriented:</p>
 *
 * <pre>
 * # Updated: 2025-01-15
 * FFMPEG_VERSION=n8.0.1
 * OPUS_SHA256=...
 * </pre>
 *
 * <p>Writes only touch the timestamp comment and the value of keys that are updated.
 * Comments, ordering, blank lines, indentation and line terminators are preserved.</p>
 */
public class VersionsFileRepository {

    private static final Logger LOGGER = Logger.getLogger(VersionsFileRepository.class.getName());

    private static final String FFMPEG_VERSION_KEY = "FFMPEG_VERSION";

    private final Clock clock;

    public VersionsFileRepository() {
        this(Clock.systemDefaultZone());
    }

    public VersionsFileRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public VersionsFile read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try {
            return VersionsFile.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new ConfigFileNotFoundException(path, e);
        }
    }

    /**
     * @return key/value pairs in file order, the last occurrence of a duplicate key winning
     * @throws ConfigFileNotFoundException if the file does not exist
     */
    public Map<String, String> parse(Path path) throws IOException {
        return read(path).toMap();
    }

    /**
     * Applies {@code updates} to the file at {@code path} and refreshes its timestamp comment.
     * Keys that are not present in the file are ignored.
     */
    public void write(Path path, Map<String, String> updates) throws IOException {
        VersionsFile file = read(path);
        Map<String, String> existing = file.toMap();
        for (String key : updates.keySet()) {
            if (!existing.containsKey(key)) {
                LOGGER.log(Level.FINE, "Ignoring update for {0}; key not present in {1}",
                        new Object[]{key, path.getFileName()});
            }
        }
        String content = file.render(updates, LocalDate.now(clock));
        replaceContent(path, content);
        LOGGER.log(Level.FINE, "Wrote {0} value(s) to {1}", new Object[]{updates.size(), path});
    }

    public VersionsMetadata metadata(Path path) throws IOException {
        return metadata(read(path));
    }

    public VersionsMetadata metadata(VersionsFile file) {
        String lastUpdated = file.timestamp().orElseGet(() -> LocalDate.now(clock).toString());
        String ffmpegVersion = file.get(FFMPEG_VERSION_KEY)
                .filter(value -> value.startsWith("n") && value.length() > 1)
                .map(value -> value.substring(1))
                .orElse(VersionsMetadata.UNKNOWN);
        return new VersionsMetadata(lastUpdated, ffmpegVersion);
    }

    /**
     * Replaces the file through a sibling temp file. A symlinked path keeps its link and the
     * file it points to is rewritten. POSIX permissions of the replaced file carry over.
     */
    private void replaceContent(Path path, String content) throws IOException {
        Path target = Files.exists(path) ? path.toRealPath() : path.toAbsolutePath();
        Path tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            copyPermissions(target, tempFile);
            try {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.log(Level.FINE, "Atomic move not supported for {0}; falling back to replace", target);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private static void copyPermissions(Path source, Path destination) throws IOException {
        if (!Files.exists(source)
                || !Files.getFileStore(source).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(source);
        Files.setPosixFilePermissions(destination, permissions);
    }
}

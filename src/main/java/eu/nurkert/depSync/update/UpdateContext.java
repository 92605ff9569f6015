package eu.nurkert.depSync.update;

import eu.nurkert.depSync.fetcher.TagFetcher;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mutable state of one dependency check. The descriptor, fetcher and pinned version are
 * fixed; the steps fill in the rest.
 */
public class UpdateContext {

    public static final String UNKNOWN_VERSION = "unknown";

    private final DependencyDescriptor dependency;
    private final TagFetcher fetcher;
    private final String currentVersion;
    private final Logger logger;

    private boolean cancelled;
    private String cancelReason;
    private String latestVersion;
    private boolean updated;
    private String downloadUrl;
    private String sha256;
    private String checksumError;

    public UpdateContext(DependencyDescriptor dependency, TagFetcher fetcher, String currentVersion, Logger logger) {
        this.dependency = Objects.requireNonNull(dependency, "dependency");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.currentVersion = currentVersion != null ? currentVersion : UNKNOWN_VERSION;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public DependencyDescriptor getDependency() {
        return dependency;
    }

    public TagFetcher getFetcher() {
        return fetcher;
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel(String reason) {
        this.cancelled = true;
        this.cancelReason = reason;
    }

    public Optional<String> getCancelReason() {
        return Optional.ofNullable(cancelReason);
    }

    public String getLatestVersion() {
        return latestVersion;
    }

    public void setLatestVersion(String latestVersion) {
        this.latestVersion = latestVersion;
    }

    public boolean isUpdated() {
        return updated;
    }

    public void setUpdated(boolean updated) {
        this.updated = updated;
    }

    public Optional<String> getDownloadUrl() {
        return Optional.ofNullable(downloadUrl);
    }

    public void setDownloadUrl(String downloadUrl) {
        this.downloadUrl = downloadUrl;
    }

    public Optional<String> getSha256() {
        return Optional.ofNullable(sha256);
    }

    public void setSha256(String sha256) {
        this.sha256 = sha256;
    }

    public Optional<String> getChecksumError() {
        return Optional.ofNullable(checksumError);
    }

    public void setChecksumError(String checksumError) {
        this.checksumError = checksumError;
    }

    public void log(Level level, String message, Object... args) {
        logger.log(level, message, args);
    }
}

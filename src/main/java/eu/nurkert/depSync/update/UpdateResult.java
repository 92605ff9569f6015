package eu.nurkert.depSync.update;

import java.util.Optional;

/**
 * Outcome of checking one dependency.
 *
 * @param name           dependency name
 * @param currentVersion pinned version, {@code unknown} when the file has no entry
 * @param latestVersion  normalized upstream version, {@code error} when the fetch failed
 * @param updated        whether the pin should move to {@code latestVersion}
 * @param sha256         checksum of the new artifact, if one was computed
 * @param error          fetch failure message
 * @param checksumError  checksum download failure message
 */
public record UpdateResult(String name,
                           String currentVersion,
                           String latestVersion,
                           boolean updated,
                           String sha256,
                           String error,
                           String checksumError) {

    public static final String ERROR_VERSION = "error";

    public static UpdateResult fromContext(UpdateContext context) {
        return new UpdateResult(context.getDependency().getName(),
                context.getCurrentVersion(),
                context.getLatestVersion(),
                context.isUpdated(),
                context.getSha256().orElse(null),
                null,
                context.getChecksumError().orElse(null));
    }

    public static UpdateResult failed(String name, String currentVersion, String error) {
        return new UpdateResult(name, currentVersion, ERROR_VERSION, false, null, error, null);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasChecksumError() {
        return checksumError != null;
    }

    public Optional<String> getSha256() {
        return Optional.ofNullable(sha256);
    }
}

package eu.nurkert.depSync.update;

import eu.nurkert.depSync.handlers.ChecksumDownloadException;
import eu.nurkert.depSync.handlers.ChecksumVerifier;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Hashes the release artifact of an updated dependency so the new checksum can be pinned
 * alongside the version. A failed download is recorded on the context and does not fail
 * the job.
 */
public class ChecksumUpdateStep implements UpdateStep {

    private final ChecksumVerifier checksumVerifier;

    public ChecksumUpdateStep(ChecksumVerifier checksumVerifier) {
        this.checksumVerifier = Objects.requireNonNull(checksumVerifier, "checksumVerifier");
    }

    @Override
    public void execute(UpdateContext context) {
        DependencyDescriptor dependency = context.getDependency();
        if (!context.isUpdated() || !dependency.verifiesChecksum()) {
            return;
        }
        Optional<String> downloadUrl = context.getDownloadUrl();
        if (downloadUrl.isEmpty()) {
            return;
        }
        try {
            context.setSha256(checksumVerifier.checksum(downloadUrl.get()));
        } catch (ChecksumDownloadException e) {
            context.setChecksumError(e.getMessage());
            context.log(Level.WARNING, "Could not compute checksum for {0}: {1}",
                    dependency.getName(), e.getMessage());
        }
    }
}

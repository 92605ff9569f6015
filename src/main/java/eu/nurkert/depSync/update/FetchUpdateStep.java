package eu.nurkert.depSync.update;

import java.util.Objects;
import java.util.logging.Level;

/**
 * Fetches the latest stable upstream version and decides whether the pin is outdated.
 * A pin that is ahead of upstream is left alone.
 */
public class FetchUpdateStep implements UpdateStep {

    private final VersionComparator versionComparator;

    public FetchUpdateStep(VersionComparator versionComparator) {
        this.versionComparator = Objects.requireNonNull(versionComparator, "versionComparator");
    }

    @Override
    public void execute(UpdateContext context) throws Exception {
        DependencyDescriptor dependency = context.getDependency();
        String rawTag = context.getFetcher().fetchLatest();
        String latest = dependency.normalize(rawTag);
        context.setLatestVersion(latest);

        String current = context.getCurrentVersion();
        boolean updated = !latest.equals(current) && versionComparator.compare(latest, current) >= 0;
        context.setUpdated(updated);
        if (!updated) {
            context.cancel("Up to date");
            context.log(Level.FINE, "{0} is up to date ({1}, upstream {2})",
                    dependency.getName(), current, latest);
            return;
        }

        dependency.downloadUrl(latest).ifPresent(context::setDownloadUrl);
        context.log(Level.FINE, "{0} can be updated from {1} to {2}",
                dependency.getName(), current, latest);
    }
}

package eu.nurkert.depSync.update;

import eu.nurkert.depSync.fetcher.exception.NoStableTagsFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Picks the newest stable tag out of the raw tag list returned by a registry.
 */
public class StableTagSelector {

    private final VersionComparator versionComparator;
    private final PrereleaseClassifier prereleaseClassifier;

    public StableTagSelector() {
        this(new VersionComparator(), new PrereleaseClassifier());
    }

    public StableTagSelector(VersionComparator versionComparator, PrereleaseClassifier prereleaseClassifier) {
        this.versionComparator = Objects.requireNonNull(versionComparator, "versionComparator");
        this.prereleaseClassifier = Objects.requireNonNull(prereleaseClassifier, "prereleaseClassifier");
    }

    /**
     * Returns the highest tag that fully matches {@code tagPattern} and is not a prerelease.
     * <p>
     * Equal-comparing tags keep their input order because {@link List#sort} is stable, so
     * the earliest of them wins.
     *
     * @throws NoStableTagsFoundException if no tag qualifies
     */
    public String selectLatestStableTag(Collection<String> tags, Pattern tagPattern) throws NoStableTagsFoundException {
        Objects.requireNonNull(tagPattern, "tagPattern");
        List<String> matching = new ArrayList<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null
                        && tagPattern.matcher(tag).matches()
                        && !prereleaseClassifier.isPrerelease(tag)) {
                    matching.add(tag);
                }
            }
        }

        if (matching.isEmpty()) {
            throw new NoStableTagsFoundException(tagPattern.pattern(), tags);
        }

        matching.sort(versionComparator.reversed());
        return matching.get(0);
    }
}

package eu.nurkert.depSync.fetcher.exception;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Signals that a registry answered, but none of its tags matched the tag pattern or every
 * match was a prerelease. Unlike a transport failure this is not worth retrying.
 */
public class NoStableTagsFoundException extends IOException {

    private final String tagPattern;
    private final List<String> candidates;

    public NoStableTagsFoundException(String tagPattern, Collection<String> candidates) {
        super("No stable tags found matching " + tagPattern);
        this.tagPattern = tagPattern;
        if (candidates == null || candidates.isEmpty()) {
            this.candidates = List.of();
        } else {
            this.candidates = candidates.stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toUnmodifiableList());
        }
    }

    public String getTagPattern() {
        return tagPattern;
    }

    /**
     * @return the tags the registry returned before filtering
     */
    public List<String> getCandidates() {
        return candidates;
    }

    @Override
    public String toString() {
        return getMessage();
    }
}

package eu.nurkert.depSync.fetcher;

import java.util.Objects;

/**
 * Returns a fixed pin, e.g. a maintained branch name or a version bumped by hand.
 */
public class StaticVersionFetcher implements TagFetcher {

    private final String version;

    public StaticVersionFetcher(String version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    @Override
    public String fetchLatest() {
        return version;
    }
}

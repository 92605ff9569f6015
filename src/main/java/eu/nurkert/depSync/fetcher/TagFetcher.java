package eu.nurkert.depSync.fetcher;

import java.io.IOException;

/**
 * Looks up the latest release of one dependency on the registry that hosts it.
 */
@FunctionalInterface
public interface TagFetcher {

    /**
     * Fetches the latest stable version as published upstream, before any
     * dependency-specific normalisation.
     *
     * @return the raw tag or pinned version
     * @throws IOException if the registry cannot be reached after retries, answers 404,
     *                     or lists no eligible tag
     */
    String fetchLatest() throws IOException;
}

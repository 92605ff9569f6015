package eu.nurkert.depSync.fetcher;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.update.StableTagSelector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Fetcher for BitBucket Cloud repositories.
 * <p>
 * BitBucket pages tags oldest first, so the newest tag is usually on the last page. Every
 * {@code next} link is followed before any filtering happens.
 */
public class BitbucketTagFetcher extends JsonTagFetcher {

    public static final String DEFAULT_API_BASE_URL = "https://api.bitbucket.org";

    private static final Logger LOGGER = Logger.getLogger(BitbucketTagFetcher.class.getName());
    private static final String TAGS_API_TEMPLATE = "%s/2.0/repositories/%s/refs/tags?pagelen=%d";

    private final String repo;
    private final String apiBaseUrl;
    private final int pageSize;

    public BitbucketTagFetcher(String repo,
                               Pattern tagPattern,
                               HttpClient httpClient,
                               StableTagSelector tagSelector,
                               String apiBaseUrl,
                               int pageSize) {
        super(httpClient, tagSelector, tagPattern);
        this.repo = Objects.requireNonNull(repo, "repo");
        this.apiBaseUrl = trimTrailingSlash(apiBaseUrl);
        this.pageSize = Math.max(1, pageSize);
    }

    @Override
    protected List<String> fetchTagNames() throws IOException {
        List<String> tags = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String nextUrl = buildTagsUrl();
        int pages = 0;

        while (nextUrl != null) {
            if (!visited.add(nextUrl)) {
                throw new IOException("BitBucket pagination for " + repo + " loops back to " + nextUrl);
            }
            TagPage page = getJson(nextUrl, TagPage.class);
            pages++;
            if (page == null) {
                break;
            }
            tags.addAll(names(page.values()));
            nextUrl = page.next() == null || page.next().isBlank() ? null : page.next();
        }

        LOGGER.log(Level.FINE, "BitBucket returned {0} tags on {1} page(s) for {2}",
                new Object[]{tags.size(), pages, repo});
        return tags;
    }

    String buildTagsUrl() {
        return String.format(TAGS_API_TEMPLATE, apiBaseUrl, repo, pageSize);
    }

    record TagPage(
            @JsonProperty("values") List<Tag> values,
            @JsonProperty("next") String next
    ) {
        TagPage {
            values = values == null ? List.of() : values;
        }
    }
}

package eu.nurkert.depSync.fetcher;

import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.update.StableTagSelector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Fetcher that lists repository tags through the GitHub REST API.
 * <p>
 * GitHub returns tags newest first, so only the first {@code maxPages} pages are read.
 */
public class GithubTagFetcher extends JsonTagFetcher {

    public static final String DEFAULT_API_BASE_URL = "https://api.github.com";
    public static final Map<String, String> GITHUB_HEADERS = Map.of(
            "Accept", "application/vnd.github+json",
            "X-GitHub-Api-Version", "2022-11-28"
    );

    private static final Logger LOGGER = Logger.getLogger(GithubTagFetcher.class.getName());
    private static final String TAGS_API_TEMPLATE = "%s/repos/%s/tags?per_page=%d&page=%d";

    private final String repo;
    private final String apiBaseUrl;
    private final int pageSize;
    private final int maxPages;

    public GithubTagFetcher(String repo,
                            Pattern tagPattern,
                            HttpClient httpClient,
                            StableTagSelector tagSelector,
                            String apiBaseUrl,
                            int pageSize,
                            int maxPages) {
        super(httpClient, tagSelector, tagPattern);
        this.repo = Objects.requireNonNull(repo, "repo");
        this.apiBaseUrl = trimTrailingSlash(apiBaseUrl);
        this.pageSize = Math.max(1, pageSize);
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    protected List<String> fetchTagNames() throws IOException {
        List<String> tags = new ArrayList<>();
        for (int page = 1; page <= maxPages; page++) {
            Tag[] pageTags = getJson(buildTagsUrl(page), Tag[].class);
            if (pageTags == null || pageTags.length == 0) {
                break;
            }
            tags.addAll(names(Arrays.asList(pageTags)));
            if (pageTags.length < pageSize) {
                break;
            }
        }
        LOGGER.log(Level.FINE, "GitHub returned {0} tags for {1}", new Object[]{tags.size(), repo});
        return tags;
    }

    String buildTagsUrl(int page) {
        return String.format(TAGS_API_TEMPLATE, apiBaseUrl, repo, pageSize, page);
    }
}

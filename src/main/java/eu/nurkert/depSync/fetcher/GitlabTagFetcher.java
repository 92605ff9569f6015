package eu.nurkert.depSync.fetcher;

import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.update.StableTagSelector;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fetcher that reads the tags of a project on any GitLab instance.
 * <p>
 * A single page is requested; GitLab orders tags by last update, newest first.
 */
public class GitlabTagFetcher extends JsonTagFetcher {

    private static final String TAGS_API_TEMPLATE = "%s/api/v4/projects/%s/repository/tags?per_page=%d";

    private final String baseUrl;
    private final String project;
    private final int pageSize;

    /**
     * @param baseUrl scheme and host of the GitLab instance, e.g. {@code https://gitlab.com}
     * @param project path of the project, e.g. {@code AOMediaCodec/SVT-AV1}
     */
    public GitlabTagFetcher(String baseUrl,
                            String project,
                            Pattern tagPattern,
                            HttpClient httpClient,
                            StableTagSelector tagSelector,
                            int pageSize) {
        super(httpClient, tagSelector, tagPattern);
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.project = Objects.requireNonNull(project, "project");
        this.pageSize = Math.max(1, pageSize);
    }

    /**
     * Builds the instance URL for a bare host name.
     */
    public static String baseUrlForHost(String host) {
        String trimmed = Objects.requireNonNull(host, "host").trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    @Override
    protected List<String> fetchTagNames() throws IOException {
        Tag[] tags = getJson(buildTagsUrl(), Tag[].class);
        return tags != null ? names(Arrays.asList(tags)) : List.of();
    }

    String buildTagsUrl() {
        String encodedProject = URLEncoder.encode(project, StandardCharsets.UTF_8);
        return String.format(TAGS_API_TEMPLATE, baseUrl, encodedProject, pageSize);
    }
}

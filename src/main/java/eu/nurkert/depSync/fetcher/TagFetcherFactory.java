package eu.nurkert.depSync.fetcher;

import eu.nurkert.depSync.core.SyncSettings;
import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.update.FetchSource;
import eu.nurkert.depSync.update.StableTagSelector;

import java.time.Duration;
import java.util.Objects;

/**
 * Creates the {@link TagFetcher} matching a {@link FetchSource} variant.
 */
public class TagFetcherFactory implements FetchSource.Visitor<TagFetcher> {

    private final HttpClient githubClient;
    private final HttpClient defaultClient;
    private final StableTagSelector tagSelector;
    private final String githubApiBaseUrl;
    private final String bitbucketApiBaseUrl;
    private final int pageSize;
    private final int githubMaxPages;

    public TagFetcherFactory(HttpClient githubClient,
                             HttpClient defaultClient,
                             StableTagSelector tagSelector,
                             String githubApiBaseUrl,
                             String bitbucketApiBaseUrl,
                             int pageSize,
                             int githubMaxPages) {
        this.githubClient = Objects.requireNonNull(githubClient, "githubClient");
        this.defaultClient = Objects.requireNonNull(defaultClient, "defaultClient");
        this.tagSelector = Objects.requireNonNull(tagSelector, "tagSelector");
        this.githubApiBaseUrl = Objects.requireNonNull(githubApiBaseUrl, "githubApiBaseUrl");
        this.bitbucketApiBaseUrl = Objects.requireNonNull(bitbucketApiBaseUrl, "bitbucketApiBaseUrl");
        this.pageSize = pageSize;
        this.githubMaxPages = githubMaxPages;
    }

    /**
     * Wires HTTP clients from the settings. The GitHub client authenticates when
     * {@code githubToken} is present, which lifts the anonymous rate limit.
     */
    public static TagFetcherFactory fromSettings(SyncSettings settings, String githubToken) {
        HttpClient githubClient = baseClient(settings)
                .headers(GithubTagFetcher.GITHUB_HEADERS)
                .bearerToken(githubToken)
                .build();
        HttpClient defaultClient = baseClient(settings).build();
        return new TagFetcherFactory(githubClient,
                defaultClient,
                new StableTagSelector(),
                settings.api().github(),
                settings.api().bitbucket(),
                settings.tagPageSize(),
                settings.githubMaxPages());
    }

    private static HttpClient.Builder baseClient(SyncSettings settings) {
        return HttpClient.builder()
                .userAgent(settings.userAgent())
                .connectTimeout(Duration.ofSeconds(settings.http().connectTimeoutSeconds()))
                .requestTimeout(Duration.ofSeconds(settings.http().requestTimeoutSeconds()))
                .retryPolicy(settings.retryPolicy());
    }

    public TagFetcher create(FetchSource source) {
        return Objects.requireNonNull(source, "source").accept(this);
    }

    @Override
    public TagFetcher visitStatic(FetchSource.Static source) {
        return new StaticVersionFetcher(source.version());
    }

    @Override
    public TagFetcher visitGitHub(FetchSource.GitHubTags source) {
        return new GithubTagFetcher(source.repo(), source.tagPattern(), githubClient, tagSelector,
                githubApiBaseUrl, pageSize, githubMaxPages);
    }

    @Override
    public TagFetcher visitGitLab(FetchSource.GitLabTags source) {
        return new GitlabTagFetcher(GitlabTagFetcher.baseUrlForHost(source.host()), source.project(),
                source.tagPattern(), defaultClient, tagSelector, pageSize);
    }

    @Override
    public TagFetcher visitBitBucket(FetchSource.BitBucketTags source) {
        return new BitbucketTagFetcher(source.repo(), source.tagPattern(), defaultClient, tagSelector,
                bitbucketApiBaseUrl, pageSize);
    }
}

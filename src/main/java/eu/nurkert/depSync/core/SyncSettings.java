package eu.nurkert.depSync.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import eu.nurkert.depSync.fetcher.BitbucketTagFetcher;
import eu.nurkert.depSync.fetcher.GithubTagFetcher;
import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.net.RetryPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Tunables read from {@code dependency-sync.yml}. Missing entries fall back to the
 * defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings(
        @JsonProperty("versionsFile") String versionsFile,
        @JsonProperty("githubOutputEnv") String githubOutputEnv,
        @JsonProperty("tokenEnv") List<String> tokenEnv,
        @JsonProperty("userAgent") String userAgent,
        @JsonProperty("tagPageSize") Integer tagPageSize,
        @JsonProperty("githubMaxPages") Integer githubMaxPages,
        @JsonProperty("maxConcurrency") Integer maxConcurrency,
        @JsonProperty("http") Http http,
        @JsonProperty("retry") Retry retry,
        @JsonProperty("api") Api api
) {

    public static final String DEFAULT_VERSIONS_FILE = "versions.properties";

    public SyncSettings {
        versionsFile = blankToDefault(versionsFile, DEFAULT_VERSIONS_FILE);
        githubOutputEnv = blankToDefault(githubOutputEnv, "GITHUB_OUTPUT");
        tokenEnv = tokenEnv == null ? List.of("GITHUB_TOKEN", "GH_TOKEN") : List.copyOf(tokenEnv);
        userAgent = blankToDefault(userAgent, HttpClient.DEFAULT_USER_AGENT);
        tagPageSize = positiveOrDefault(tagPageSize, 100);
        githubMaxPages = positiveOrDefault(githubMaxPages, 2);
        maxConcurrency = maxConcurrency == null || maxConcurrency < 0 ? 0 : maxConcurrency;
        http = http == null ? new Http(null, null, null) : http;
        retry = retry == null ? new Retry(null, null, null) : retry;
        api = api == null ? new Api(null, null) : api;
    }

    public static SyncSettings defaults() {
        return new SyncSettings(null, null, null, null, null, null, null, null, null, null);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.attempts(),
                Duration.ofMillis(retry.baseDelayMillis()),
                Duration.ofMillis(retry.maxDelayMillis()));
    }

    /**
     * Timeouts in seconds. Artifact downloads get their own, longer budget.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Http(
            @JsonProperty("connectTimeoutSeconds") Integer connectTimeoutSeconds,
            @JsonProperty("requestTimeoutSeconds") Integer requestTimeoutSeconds,
            @JsonProperty("downloadTimeoutSeconds") Integer downloadTimeoutSeconds
    ) {
        public Http {
            connectTimeoutSeconds = positiveOrDefault(connectTimeoutSeconds, 5);
            requestTimeoutSeconds = positiveOrDefault(requestTimeoutSeconds, 10);
            downloadTimeoutSeconds = positiveOrDefault(downloadTimeoutSeconds, 300);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Retry(
            @JsonProperty("attempts") Integer attempts,
            @JsonProperty("baseDelayMillis") Long baseDelayMillis,
            @JsonProperty("maxDelayMillis") Long maxDelayMillis
    ) {
        public Retry {
            attempts = positiveOrDefault(attempts, RetryPolicy.DEFAULT_MAX_ATTEMPTS);
            baseDelayMillis = baseDelayMillis == null || baseDelayMillis < 0
                    ? RetryPolicy.DEFAULT_BASE_DELAY.toMillis() : baseDelayMillis;
            maxDelayMillis = maxDelayMillis == null || maxDelayMillis < 0
                    ? RetryPolicy.DEFAULT_MAX_DELAY.toMillis() : maxDelayMillis;
        }
    }

    /**
     * Base URLs of the hosted registries; GitLab hosts come from each dependency.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Api(
            @JsonProperty("github") String github,
            @JsonProperty("bitbucket") String bitbucket
    ) {
        public Api {
            github = blankToDefault(github, GithubTagFetcher.DEFAULT_API_BASE_URL);
            bitbucket = blankToDefault(bitbucket, BitbucketTagFetcher.DEFAULT_API_BASE_URL);
        }
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Integer positiveOrDefault(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}

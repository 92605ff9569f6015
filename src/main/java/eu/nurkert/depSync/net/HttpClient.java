package eu.nurkert.depSync.net;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lightweight HTTP client wrapper that provides sane defaults for timeouts,
 * headers, retries and error handling.
 */
public class HttpClient {

    public static final String DEFAULT_USER_AGENT = "dependency-sync/1.0";

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Map<String, String> DEFAULT_HEADERS = Map.of(
            "User-Agent", DEFAULT_USER_AGENT,
            "Accept", "application/json"
    );

    private final java.net.http.HttpClient client;
    private final Duration requestTimeout;
    private final Map<String, String> defaultHeaders;
    private final RetryPolicy retryPolicy;

    protected HttpClient(java.net.http.HttpClient client, Duration requestTimeout, Map<String, String> defaultHeaders) {
        this(client, requestTimeout, defaultHeaders, RetryPolicy.none());
    }

    protected HttpClient(java.net.http.HttpClient client,
                         Duration requestTimeout,
                         Map<String, String> defaultHeaders,
                         RetryPolicy retryPolicy) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.defaultHeaders = Map.copyOf(defaultHeaders);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    private HttpClient(Builder builder) {
        this(builder.client, builder.requestTimeout, builder.buildHeaders(), builder.retryPolicy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes an HTTP GET request and returns the response body as a string.
     * Failed attempts are retried according to the configured {@link RetryPolicy}.
     *
     * @param url the URL to invoke
     * @return response body
     * @throws IOException when every attempt fails or the server answers 404
     */
    public String get(String url) throws IOException {
        return retryPolicy.execute(url, () -> doGet(url));
    }

    /**
     * Opens the response body of a GET request as a stream. The caller owns the
     * returned stream and must close it.
     */
    public InputStream openStream(String url) throws IOException {
        return retryPolicy.execute(url, () -> doOpenStream(url));
    }

    protected String doGet(String url) throws IOException, InterruptedException {
        HttpResponse<String> response = client.send(newRequest(url), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int statusCode = response.statusCode();
        if (isSuccessful(statusCode)) {
            return response.body();
        }
        throw new HttpException(url, statusCode, response.body());
    }

    protected InputStream doOpenStream(String url) throws IOException, InterruptedException {
        HttpResponse<InputStream> response = client.send(newRequest(url), HttpResponse.BodyHandlers.ofInputStream());
        int statusCode = response.statusCode();
        if (isSuccessful(statusCode)) {
            return response.body();
        }
        String body;
        try (InputStream errorStream = response.body()) {
            body = new String(errorStream.readAllBytes(), StandardCharsets.UTF_8);
        }
        throw new HttpException(url, statusCode, body);
    }

    private HttpRequest newRequest(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .GET();
        defaultHeaders.forEach(builder::header);
        return builder.build();
    }

    private static boolean isSuccessful(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    public static final class Builder {

        private java.net.http.HttpClient client;
        private Duration connectTimeout;
        private Duration requestTimeout;
        private RetryPolicy retryPolicy;
        private final Map<String, String> headers;

        private Builder() {
            this.connectTimeout = DEFAULT_CONNECT_TIMEOUT;
            this.requestTimeout = DEFAULT_REQUEST_TIMEOUT;
            this.retryPolicy = RetryPolicy.defaults();
            this.headers = new LinkedHashMap<>(DEFAULT_HEADERS);
        }

        public Builder client(java.net.http.HttpClient client) {
            this.client = Objects.requireNonNull(client, "client");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder header(String key, String value) {
            if (key == null) {
                return this;
            }
            if (value == null) {
                headers.remove(key);
            } else {
                headers.put(key, value);
            }
            return this;
        }

        public Builder headers(Map<String, String> additionalHeaders) {
            if (additionalHeaders == null || additionalHeaders.isEmpty()) {
                return this;
            }
            additionalHeaders.forEach(this::header);
            return this;
        }

        public Builder userAgent(String userAgent) {
            return header("User-Agent", userAgent);
        }

        public Builder accept(String mediaType) {
            return header("Accept", mediaType);
        }

        /**
         * Adds an {@code Authorization: Bearer} header when {@code token} is not blank.
         */
        public Builder bearerToken(String token) {
            if (token == null || token.isBlank()) {
                return this;
            }
            return header("Authorization", "Bearer " + token.trim());
        }

        private Map<String, String> buildHeaders() {
            return Map.copyOf(headers);
        }

        public HttpClient build() {
            if (client == null) {
                client = java.net.http.HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                        .build();
            }
            return new HttpClient(this);
        }
    }
}

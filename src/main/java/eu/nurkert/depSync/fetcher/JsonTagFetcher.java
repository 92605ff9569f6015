package eu.nurkert.depSync.fetcher;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.update.StableTagSelector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base class for fetchers that list tags through a JSON based HTTP API.
 */
public abstract class JsonTagFetcher implements TagFetcher {

    private static final ObjectMapper DEFAULT_MAPPER = defaultMapper();

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final StableTagSelector tagSelector;
    private final Pattern tagPattern;

    protected JsonTagFetcher(HttpClient httpClient, StableTagSelector tagSelector, Pattern tagPattern) {
        this(httpClient, DEFAULT_MAPPER, tagSelector, tagPattern);
    }

    protected JsonTagFetcher(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             StableTagSelector tagSelector,
                             Pattern tagPattern) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.tagSelector = Objects.requireNonNull(tagSelector, "tagSelector");
        this.tagPattern = Objects.requireNonNull(tagPattern, "tagPattern");
    }

    static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public String fetchLatest() throws IOException {
        return tagSelector.selectLatestStableTag(fetchTagNames(), tagPattern);
    }

    /**
     * Lists every tag name the registry offers for this dependency, in registry order.
     */
    protected abstract List<String> fetchTagNames() throws IOException;

    protected <T> T getJson(String url, Class<T> type) throws IOException {
        String body = httpClient.get(url);
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to parse response from " + url, e);
        }
    }

    protected static List<String> names(Collection<Tag> tags) {
        List<String> names = new ArrayList<>();
        if (tags == null) {
            return names;
        }
        for (Tag tag : tags) {
            if (tag != null && tag.name() != null && !tag.name().isBlank()) {
                names.add(tag.name().trim());
            }
        }
        return names;
    }

    protected static String trimTrailingSlash(String value) {
        String trimmed = Objects.requireNonNull(value, "value").trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * The one field all supported tag APIs have in common.
     */
    record Tag(@JsonProperty("name") String name) {
    }
}

package eu.nurkert.depSync.fetcher;

import eu.nurkert.depSync.update.DependencyRegistry;
import eu.nurkert.depSync.update.StableTagSelector;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BitbucketTagFetcherTest {

    private static final String FIRST_PAGE =
            "https://api.bitbucket.org/2.0/repositories/multicoreware/x265_git/refs/tags?pagelen=100";
    private static final String SECOND_PAGE = FIRST_PAGE + "&page=2";
    private static final String THIRD_PAGE = FIRST_PAGE + "&page=3";

    @Test
    void followsNextLinksUntilTheLastPage() throws Exception {
        Map<String, String> responses = new HashMap<>();
        responses.put(FIRST_PAGE, page(SECOND_PAGE, "2.9", "3.0"));
        responses.put(SECOND_PAGE, page(THIRD_PAGE, "3.5", "3.6_RC1"));
        responses.put(THIRD_PAGE, page(null, "4.0", "4.1"));
        StubHttpClient client = new StubHttpClient(responses);

        assertEquals("4.1", fetcher(client).fetchLatest());
        assertEquals(List.of(FIRST_PAGE, SECOND_PAGE, THIRD_PAGE), client.getRequestedUrls());
    }

    @Test
    void detectsPaginationLoops() {
        Map<String, String> responses = new HashMap<>();
        responses.put(FIRST_PAGE, page(SECOND_PAGE, "3.0"));
        responses.put(SECOND_PAGE, page(FIRST_PAGE, "3.1"));
        StubHttpClient client = new StubHttpClient(responses);

        assertThrows(IOException.class, () -> fetcher(client).fetchLatest());
        assertEquals(2, client.getRequestedUrls().size());
    }

    @Test
    void toleratesMissingValues() throws Exception {
        Map<String, String> responses = new HashMap<>();
        responses.put(FIRST_PAGE, "{ \"next\": \"" + SECOND_PAGE + "\" }");
        responses.put(SECOND_PAGE, page(null, "3.2"));

        assertEquals("3.2", fetcher(new StubHttpClient(responses)).fetchLatest());
    }

    private static BitbucketTagFetcher fetcher(StubHttpClient client) {
        return new BitbucketTagFetcher("multicoreware/x265_git", DependencyRegistry.SEMVER_NO_PREFIX_TAG, client,
                new StableTagSelector(), BitbucketTagFetcher.DEFAULT_API_BASE_URL, 100);
    }

    private static String page(String next, String... tags) {
        StringBuilder values = new StringBuilder();
        for (String tag : tags) {
            if (values.length() > 0) {
                values.append(',');
            }
            values.append("{\"name\":\"").append(tag).append("\",\"type\":\"tag\"}");
        }
        String nextField = next != null ? ",\"next\":\"" + next + "\"" : "";
        return "{\"pagelen\":100,\"values\":[" + values + "]" + nextField + "}";
    }
}

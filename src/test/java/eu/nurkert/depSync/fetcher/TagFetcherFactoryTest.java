package eu.nurkert.depSync.fetcher;

import eu.nurkert.depSync.core.SyncSettings;
import eu.nurkert.depSync.update.DependencyRegistry;
import eu.nurkert.depSync.update.FetchSource;
import eu.nurkert.depSync.update.StableTagSelector;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagFetcherFactoryTest {

    @Test
    void dispatchesEachSourceVariant() {
        TagFetcherFactory factory = TagFetcherFactory.fromSettings(SyncSettings.defaults(), null);

        assertInstanceOf(StaticVersionFetcher.class, factory.create(FetchSource.pinned("stable")));
        assertInstanceOf(GithubTagFetcher.class,
                factory.create(FetchSource.github("xiph/opus", DependencyRegistry.SEMVER_TAG)));
        assertInstanceOf(GitlabTagFetcher.class,
                factory.create(FetchSource.gitlab("gitlab.com", "AOMediaCodec/SVT-AV1", DependencyRegistry.SEMVER_TAG)));
        assertInstanceOf(BitbucketTagFetcher.class,
                factory.create(FetchSource.bitbucket("multicoreware/x265_git", DependencyRegistry.SEMVER_NO_PREFIX_TAG)));
    }

    @Test
    void staticSourceNeedsNoNetwork() throws Exception {
        StubHttpClient client = new StubHttpClient(Map.of());
        TagFetcherFactory factory = new TagFetcherFactory(client, client, new StableTagSelector(),
                "https://api.github.com", "https://api.bitbucket.org", 100, 2);

        assertEquals("v3.12.1", factory.create(FetchSource.pinned("v3.12.1")).fetchLatest());
        assertTrue(client.getRequestedUrls().isEmpty());
    }

    @Test
    void usesConfiguredApiBaseUrls() throws Exception {
        Map<String, String> responses = new HashMap<>();
        responses.put("http://mirror.local/repos/xiph/opus/tags?per_page=50&page=1", "[ { \"name\": \"v1.5.2\" } ]");
        StubHttpClient githubClient = new StubHttpClient(responses);
        StubHttpClient defaultClient = new StubHttpClient(Map.of());
        TagFetcherFactory factory = new TagFetcherFactory(githubClient, defaultClient, new StableTagSelector(),
                "http://mirror.local/", "https://api.bitbucket.org", 50, 2);

        assertEquals("v1.5.2", factory.create(FetchSource.github("xiph/opus", DependencyRegistry.SEMVER_TAG)).fetchLatest());
        assertEquals(List.of("http://mirror.local/repos/xiph/opus/tags?per_page=50&page=1"), githubClient.getRequestedUrls());
    }
}

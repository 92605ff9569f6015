package eu.nurkert.depSync.update;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyRegistryTest {

    private final DependencyRegistry registry = DependencyRegistry.defaults();

    @Test
    void defaultRegistryHasUniqueNamesAndVersionKeys() {
        Set<String> names = new HashSet<>();
        Set<String> versionKeys = new HashSet<>();
        for (DependencyDescriptor dependency : registry.getDependencies()) {
            assertTrue(names.add(dependency.getName().toLowerCase()), dependency.getName());
            assertTrue(versionKeys.add(dependency.getVersionKey()), dependency.getVersionKey());
        }
        assertEquals(21, registry.size());
        assertEquals("FFmpeg", registry.getDependencies().get(0).getName());
    }

    @Test
    void everyChecksumKeyHasADownloadUrl() {
        for (DependencyDescriptor dependency : registry.getDependencies()) {
            if (dependency.getSha256Key().isPresent()) {
                assertTrue(dependency.hasDownloadUrl(), dependency.getName());
                assertTrue(dependency.verifiesChecksum(), dependency.getName());
            }
        }
    }

    @Test
    void findsByNameIgnoringCase() {
        assertEquals("SVT-AV1", registry.find("svt-av1").orElseThrow().getName());
        assertTrue(registry.find("unknown").isEmpty());
        assertTrue(registry.find(" ").isEmpty());
    }

    @Test
    void findsByVersionKeyCaseSensitively() {
        assertEquals("Opus", registry.findByVersionKey("OPUS_VERSION").orElseThrow().getName());
        assertTrue(registry.findByVersionKey("opus_version").isEmpty());
    }

    @Test
    void expandsDownloadUrlTemplates() {
        DependencyDescriptor opus = registry.find("Opus").orElseThrow();
        assertEquals("https://downloads.xiph.org/releases/opus/opus-1.5.2.tar.gz", opus.downloadUrl("1.5.2").orElseThrow());

        DependencyDescriptor dav1d = registry.find("dav1d").orElseThrow();
        assertEquals("https://downloads.videolan.org/pub/videolan/dav1d/1.5.0/dav1d-1.5.0.tar.xz",
                dav1d.downloadUrl("1.5.0").orElseThrow());

        assertTrue(registry.find("FFmpeg").orElseThrow().downloadUrl("n8.0.1").isEmpty());
    }

    @Test
    void normalizesPrefixedTagsToStoredForm() {
        assertEquals("1.5.2", registry.find("Opus").orElseThrow().normalize("v1.5.2"));
        assertEquals("2.16.03", registry.find("NASM").orElseThrow().normalize("nasm-2.16.03"));
        assertEquals("3.4.0", registry.find("OpenSSL").orElseThrow().normalize("openssl-3.4.0"));
        assertEquals("n8.0.1", registry.find("FFmpeg").orElseThrow().normalize("n8.0.1"));
        assertEquals("v1.15.0", registry.find("libvpx").orElseThrow().normalize("v1.15.0"));
    }

    @Test
    void selectKeepsRegistryOrder() {
        DependencyRegistry selected = registry.select(List.of("opus", "FFmpeg"));

        assertEquals(List.of("FFmpeg", "Opus"),
                selected.getDependencies().stream().map(DependencyDescriptor::getName).toList());
        assertThrows(IllegalArgumentException.class, () -> registry.select(List.of("nope")));
    }

    @Test
    void rejectsDuplicateNames() {
        DependencyDescriptor first = DependencyDescriptor.builder("Ogg")
                .versionKey("OGG_VERSION")
                .fetchSource(FetchSource.pinned("1.3.5"))
                .build();
        DependencyDescriptor second = DependencyDescriptor.builder("ogg")
                .versionKey("OGG2_VERSION")
                .fetchSource(FetchSource.pinned("1.3.5"))
                .build();

        assertThrows(IllegalArgumentException.class, () -> new DependencyRegistry(List.of(first, second)));
    }

    @Test
    void rejectsChecksumKeyWithoutDownloadUrl() {
        DependencyDescriptor.Builder builder = DependencyDescriptor.builder("broken")
                .versionKey("BROKEN_VERSION")
                .sha256Key("BROKEN_SHA256")
                .fetchSource(FetchSource.pinned("1.0"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void exposesFetchSourceVariants() {
        assertEquals("github", registry.find("FFmpeg").orElseThrow().getFetchSource().type());
        assertEquals("static", registry.find("x264").orElseThrow().getFetchSource().type());
        assertEquals("bitbucket", registry.find("x265").orElseThrow().getFetchSource().type());
        assertEquals("gitlab", registry.find("dav1d").orElseThrow().getFetchSource().type());
        assertFalse(registry.find("x264").orElseThrow().getLicense().isEmpty());
    }
}

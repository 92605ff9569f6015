package eu.nurkert.depSync.update;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The static list of tracked dependencies, in report order.
 */
public class DependencyRegistry {

    public static final Pattern SEMVER_TAG = Pattern.compile("^v[0-9]+(?:\\.[0-9]+)*$");
    public static final Pattern SEMVER_NO_PREFIX_TAG = Pattern.compile("^[0-9]+(?:\\.[0-9]+)*$");
    public static final Pattern FFMPEG_TAG = Pattern.compile("^n[0-9]+(?:\\.[0-9]+){1,2}$");
    public static final Pattern NASM_TAG = Pattern.compile("^nasm-[0-9]+(?:\\.[0-9]+)*$");
    public static final Pattern OPENSSL_TAG = Pattern.compile("^openssl-3\\.[0-9]+(?:\\.[0-9]+)?$");

    private static final String BSD_3 = "BSD-3-Clause";
    private static final String BSD_2 = "BSD-2-Clause";
    private static final String XIPH_BSD_URL = "https://www.xiph.org/licenses/bsd/";
    private static final String XIPH_DOWNLOADS = "https://xiph.org/downloads/";

    private final List<DependencyDescriptor> dependencies;

    public DependencyRegistry(List<DependencyDescriptor> dependencies) {
        this.dependencies = List.copyOf(dependencies);
        Set<String> names = new HashSet<>();
        Set<String> versionKeys = new HashSet<>();
        for (DependencyDescriptor dependency : this.dependencies) {
            if (!names.add(dependency.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate dependency name: " + dependency.getName());
            }
            if (!versionKeys.add(dependency.getVersionKey())) {
                throw new IllegalArgumentException("Duplicate version key: " + dependency.getVersionKey());
            }
        }
    }

    public List<DependencyDescriptor> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public int size() {
        return dependencies.size();
    }

    /**
     * Looks a dependency up by name, ignoring case.
     */
    public Optional<DependencyDescriptor> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return dependencies.stream()
                .filter(dependency -> dependency.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Looks a dependency up by the exact (case-sensitive) key of its version pin.
     */
    public Optional<DependencyDescriptor> findByVersionKey(String versionKey) {
        if (versionKey == null || versionKey.isEmpty()) {
            return Optional.empty();
        }
        return dependencies.stream()
                .filter(dependency -> dependency.getVersionKey().equals(versionKey))
                .findFirst();
    }

    /**
     * Returns a registry restricted to the named dependencies, keeping registry order.
     *
     * @throws IllegalArgumentException if a name is unknown
     */
    public DependencyRegistry select(List<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        for (String name : names) {
            if (find(name).isEmpty()) {
                throw new IllegalArgumentException("Unknown dependency: " + name);
            }
        }
        return new DependencyRegistry(dependencies.stream()
                .filter(dependency -> names.stream().anyMatch(dependency.getName()::equalsIgnoreCase))
                .toList());
    }

    public static DependencyRegistry defaults() {
        return new DependencyRegistry(List.of(
                DependencyDescriptor.builder("FFmpeg")
                        .homepage("https://ffmpeg.org/")
                        .releasesUrl("https://ffmpeg.org/releases/")
                        .license("LGPL-2.1", "https://ffmpeg.org/legal.html")
                        .versionKey("FFMPEG_VERSION")
                        .fetchSource(FetchSource.github("FFmpeg/FFmpeg", FFMPEG_TAG))
                        .build(),

                // Video codecs
                DependencyDescriptor.builder("x264")
                        .homepage("https://www.videolan.org/developers/x264.html")
                        .releasesUrl("https://code.videolan.org/videolan/x264/-/tags")
                        .license("GPL-2.0", "https://www.gnu.org/licenses/old-licenses/gpl-2.0.html")
                        .versionKey("X264_VERSION")
                        .fetchSource(FetchSource.pinned("stable"))
                        .build(),
                DependencyDescriptor.builder("x265")
                        .homepage("https://x265.org/")
                        .releasesUrl("https://bitbucket.org/multicoreware/x265_git/downloads/")
                        .license("GPL-2.0", "https://bitbucket.org/multicoreware/x265_git/src/master/COPYING")
                        .versionKey("X265_VERSION")
                        .fetchSource(FetchSource.bitbucket("multicoreware/x265_git", SEMVER_NO_PREFIX_TAG))
                        .build(),
                DependencyDescriptor.builder("libvpx")
                        .homepage("https://www.webmproject.org/code/")
                        .releasesUrl("https://github.com/webmproject/libvpx/releases")
                        .license(BSD_3, "https://github.com/webmproject/libvpx/blob/main/LICENSE")
                        .versionKey("LIBVPX_VERSION")
                        .fetchSource(FetchSource.github("webmproject/libvpx", SEMVER_TAG))
                        .build(),
                // googlesource has no tag API; bumped by hand
                DependencyDescriptor.builder("libaom")
                        .homepage("https://aomedia.googlesource.com/aom")
                        .releasesUrl("https://aomedia.googlesource.com/aom/+refs")
                        .license(BSD_2, "https://aomedia.org/license/software-license/")
                        .versionKey("LIBAOM_VERSION")
                        .fetchSource(FetchSource.pinned("v3.12.1"))
                        .build(),
                DependencyDescriptor.builder("SVT-AV1")
                        .homepage("https://gitlab.com/AOMediaCodec/SVT-AV1")
                        .releasesUrl("https://gitlab.com/AOMediaCodec/SVT-AV1/-/tags")
                        .license("BSD-3-Clause-Clear", "https://gitlab.com/AOMediaCodec/SVT-AV1/-/blob/master/LICENSE.md")
                        .versionKey("SVTAV1_VERSION")
                        .fetchSource(FetchSource.gitlab("gitlab.com", "AOMediaCodec/SVT-AV1", SEMVER_TAG))
                        .build(),
                DependencyDescriptor.builder("dav1d")
                        .homepage("https://code.videolan.org/videolan/dav1d")
                        .releasesUrl("https://code.videolan.org/videolan/dav1d/-/tags")
                        .license(BSD_2, "https://code.videolan.org/videolan/dav1d/-/blob/master/COPYING")
                        .versionKey("DAV1D_VERSION")
                        .urlKey("DAV1D_URL")
                        .sha256Key("DAV1D_SHA256")
                        .fetchSource(FetchSource.gitlab("code.videolan.org", "videolan/dav1d", SEMVER_NO_PREFIX_TAG))
                        .downloadUrl(v -> "https://downloads.videolan.org/pub/videolan/dav1d/" + v + "/dav1d-" + v + ".tar.xz")
                        .build(),
                DependencyDescriptor.builder("rav1e")
                        .homepage("https://github.com/xiph/rav1e")
                        .releasesUrl("https://github.com/xiph/rav1e/releases")
                        .license(BSD_2, "https://github.com/xiph/rav1e/blob/master/LICENSE")
                        .versionKey("RAV1E_VERSION")
                        .fetchSource(FetchSource.github("xiph/rav1e", SEMVER_TAG))
                        .build(),
                DependencyDescriptor.builder("Theora")
                        .homepage("https://www.theora.org/")
                        .releasesUrl(XIPH_DOWNLOADS)
                        .license(BSD_3, "https://git.xiph.org/?p=theora.git;a=blob;f=COPYING")
                        .versionKey("THEORA_VERSION")
                        .urlKey("THEORA_URL")
                        .sha256Key("THEORA_SHA256")
                        .fetchSource(FetchSource.pinned("1.1.1"))
                        .downloadUrl(v -> "https://ftp.osuosl.org/pub/xiph/releases/theora/libtheora-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("Xvid")
                        .homepage("https://www.xvid.com/")
                        .releasesUrl("https://labs.xvid.com/source/")
                        .license("GPL-2.0", "http://websvn.xvid.org/cvs/viewvc.cgi/trunk/xvidcore/LICENSE")
                        .versionKey("XVID_VERSION")
                        .urlKey("XVID_URL")
                        .sha256Key("XVID_SHA256")
                        .fetchSource(FetchSource.pinned("1.3.7"))
                        .downloadUrl(v -> "https://downloads.xvid.com/downloads/xvidcore-" + v + ".tar.gz")
                        .build(),

                // Audio codecs
                DependencyDescriptor.builder("Opus")
                        .homepage("https://opus-codec.org/")
                        .releasesUrl("https://opus-codec.org/downloads/")
                        .license(BSD_3, "https://opus-codec.org/license/")
                        .versionKey("OPUS_VERSION")
                        .urlKey("OPUS_URL")
                        .sha256Key("OPUS_SHA256")
                        .fetchSource(FetchSource.github("xiph/opus", SEMVER_TAG))
                        .stripPrefix("v")
                        .downloadUrl(v -> "https://downloads.xiph.org/releases/opus/opus-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("LAME")
                        .homepage("https://lame.sourceforge.io/")
                        .releasesUrl("https://lame.sourceforge.io/download.php")
                        .license("LGPL-2.0", "https://lame.sourceforge.io/license.txt")
                        .versionKey("LAME_VERSION")
                        .urlKey("LAME_URL")
                        .sha256Key("LAME_SHA256")
                        .fetchSource(FetchSource.pinned("3.100"))
                        .downloadUrl(v -> "https://downloads.sourceforge.net/project/lame/lame/" + v + "/lame-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("Vorbis")
                        .homepage("https://xiph.org/vorbis/")
                        .releasesUrl(XIPH_DOWNLOADS)
                        .license(BSD_3, XIPH_BSD_URL)
                        .versionKey("VORBIS_VERSION")
                        .urlKey("VORBIS_URL")
                        .sha256Key("VORBIS_SHA256")
                        .fetchSource(FetchSource.pinned("1.3.7"))
                        .downloadUrl(v -> "https://ftp.osuosl.org/pub/xiph/releases/vorbis/libvorbis-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("Ogg")
                        .homepage("https://www.xiph.org/ogg/")
                        .releasesUrl(XIPH_DOWNLOADS)
                        .license(BSD_3, XIPH_BSD_URL)
                        .versionKey("OGG_VERSION")
                        .urlKey("OGG_URL")
                        .sha256Key("OGG_SHA256")
                        .fetchSource(FetchSource.pinned("1.3.5"))
                        .downloadUrl(v -> "https://ftp.osuosl.org/pub/xiph/releases/ogg/libogg-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("fdk-aac")
                        .homepage("https://github.com/mstorsjo/fdk-aac")
                        .releasesUrl("https://github.com/mstorsjo/fdk-aac/releases")
                        .license("FDK-AAC", "https://github.com/mstorsjo/fdk-aac/blob/master/NOTICE")
                        .versionKey("FDKAAC_VERSION")
                        .fetchSource(FetchSource.github("mstorsjo/fdk-aac", SEMVER_TAG))
                        .build(),
                DependencyDescriptor.builder("FLAC")
                        .homepage("https://xiph.org/flac/")
                        .releasesUrl(XIPH_DOWNLOADS)
                        .license(BSD_3, "https://github.com/xiph/flac/blob/master/COPYING.Xiph")
                        .versionKey("FLAC_VERSION")
                        .urlKey("FLAC_URL")
                        .sha256Key("FLAC_SHA256")
                        .fetchSource(FetchSource.pinned("1.4.3"))
                        .downloadUrl(v -> "https://ftp.osuosl.org/pub/xiph/releases/flac/flac-" + v + ".tar.xz")
                        .build(),
                DependencyDescriptor.builder("Speex")
                        .homepage("https://www.speex.org/")
                        .releasesUrl(XIPH_DOWNLOADS)
                        .license(BSD_3, XIPH_BSD_URL)
                        .versionKey("SPEEX_VERSION")
                        .urlKey("SPEEX_URL")
                        .sha256Key("SPEEX_SHA256")
                        .fetchSource(FetchSource.pinned("1.2.1"))
                        .downloadUrl(v -> "https://ftp.osuosl.org/pub/xiph/releases/speex/speex-" + v + ".tar.gz")
                        .build(),

                // Subtitles and rendering
                DependencyDescriptor.builder("libass")
                        .homepage("https://github.com/libass/libass")
                        .releasesUrl("https://github.com/libass/libass/releases")
                        .license("ISC", "https://github.com/libass/libass/blob/master/COPYING")
                        .versionKey("LIBASS_VERSION")
                        .urlKey("LIBASS_URL")
                        .sha256Key("LIBASS_SHA256")
                        .fetchSource(FetchSource.github("libass/libass", SEMVER_NO_PREFIX_TAG))
                        .downloadUrl(v -> "https://github.com/libass/libass/releases/download/" + v + "/libass-" + v + ".tar.gz")
                        .build(),
                DependencyDescriptor.builder("FreeType")
                        .homepage("https://freetype.org/")
                        .releasesUrl("https://download.savannah.gnu.org/releases/freetype/")
                        .license("FTL", "https://freetype.org/license.html")
                        .versionKey("FREETYPE_VERSION")
                        .urlKey("FREETYPE_URL")
                        .sha256Key("FREETYPE_SHA256")
                        .fetchSource(FetchSource.pinned("2.13.3"))
                        .downloadUrl(v -> "https://download.savannah.gnu.org/releases/freetype/freetype-" + v + ".tar.xz")
                        .build(),

                // Build tools
                DependencyDescriptor.builder("NASM")
                        .homepage("https://www.nasm.us/")
                        .releasesUrl("https://www.nasm.us/pub/nasm/releasebuilds/")
                        .license(BSD_2, "https://github.com/netwide-assembler/nasm/blob/master/LICENSE")
                        .versionKey("NASM_VERSION")
                        .urlKey("NASM_URL")
                        .sha256Key("NASM_SHA256")
                        .fetchSource(FetchSource.github("netwide-assembler/nasm", NASM_TAG))
                        .stripPrefix("nasm-")
                        .downloadUrl(v -> "https://github.com/netwide-assembler/nasm/archive/refs/tags/nasm-" + v + ".tar.gz")
                        .build(),

                // Network
                DependencyDescriptor.builder("OpenSSL")
                        .homepage("https://www.openssl.org/")
                        .releasesUrl("https://www.openssl.org/source/")
                        .license("Apache-2.0", "https://www.openssl.org/source/license.html")
                        .versionKey("OPENSSL_VERSION")
                        .urlKey("OPENSSL_URL")
                        .sha256Key("OPENSSL_SHA256")
                        .fetchSource(FetchSource.github("openssl/openssl", OPENSSL_TAG))
                        .stripPrefix("openssl-")
                        .downloadUrl(v -> "https://www.openssl.org/source/openssl-" + v + ".tar.gz")
                        .build()
        ));
    }
}

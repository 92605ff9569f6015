package eu.nurkert.depSync.update;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Immutable description of one tracked dependency: where its latest version comes from
 * and which keys of {@code versions.properties} it owns.
 */
public final class DependencyDescriptor {

    private final String name;
    private final String versionKey;
    private final String urlKey;
    private final String sha256Key;
    private final FetchSource fetchSource;
    private final UnaryOperator<String> downloadUrl;
    private final UnaryOperator<String> normalizer;
    private final String homepage;
    private final String releasesUrl;
    private final License license;

    private DependencyDescriptor(Builder builder) {
        this.name = builder.name;
        this.versionKey = builder.versionKey;
        this.urlKey = builder.urlKey;
        this.sha256Key = builder.sha256Key;
        this.fetchSource = builder.fetchSource;
        this.downloadUrl = builder.downloadUrl;
        this.normalizer = builder.normalizer;
        this.homepage = builder.homepage;
        this.releasesUrl = builder.releasesUrl;
        this.license = builder.license;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getVersionKey() {
        return versionKey;
    }

    public Optional<String> getUrlKey() {
        return Optional.ofNullable(urlKey);
    }

    public Optional<String> getSha256Key() {
        return Optional.ofNullable(sha256Key);
    }

    public FetchSource getFetchSource() {
        return fetchSource;
    }

    public boolean hasDownloadUrl() {
        return downloadUrl != null;
    }

    /**
     * Resolves the artifact URL for {@code version}, if this dependency publishes one.
     */
    public Optional<String> downloadUrl(String version) {
        return downloadUrl != null ? Optional.of(downloadUrl.apply(version)) : Optional.empty();
    }

    /**
     * Maps a raw upstream tag to the form stored in {@code versions.properties}.
     */
    public String normalize(String rawTag) {
        return normalizer.apply(rawTag);
    }

    /**
     * A checksum is only computed when there is a key to store it under and an artifact
     * to download.
     */
    public boolean verifiesChecksum() {
        return sha256Key != null && downloadUrl != null;
    }

    public Optional<String> getHomepage() {
        return Optional.ofNullable(homepage);
    }

    public Optional<String> getReleasesUrl() {
        return Optional.ofNullable(releasesUrl);
    }

    public Optional<License> getLicense() {
        return Optional.ofNullable(license);
    }

    @Override
    public String toString() {
        return name + " (" + versionKey + ", " + fetchSource.type() + ")";
    }

    public static final class Builder {
        private final String name;
        private String versionKey;
        private String urlKey;
        private String sha256Key;
        private FetchSource fetchSource;
        private UnaryOperator<String> downloadUrl;
        private UnaryOperator<String> normalizer = UnaryOperator.identity();
        private String homepage;
        private String releasesUrl;
        private License license;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder versionKey(String versionKey) {
            this.versionKey = versionKey;
            return this;
        }

        public Builder urlKey(String urlKey) {
            this.urlKey = urlKey;
            return this;
        }

        public Builder sha256Key(String sha256Key) {
            this.sha256Key = sha256Key;
            return this;
        }

        public Builder fetchSource(FetchSource fetchSource) {
            this.fetchSource = fetchSource;
            return this;
        }

        public Builder downloadUrl(UnaryOperator<String> downloadUrl) {
            this.downloadUrl = downloadUrl;
            return this;
        }

        public Builder normalizer(UnaryOperator<String> normalizer) {
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
            return this;
        }

        /**
         * Stores the upstream tag without the given literal prefix, e.g. {@code v1.5.2}
         * becomes {@code 1.5.2}.
         */
        public Builder stripPrefix(String prefix) {
            Objects.requireNonNull(prefix, "prefix");
            Pattern leading = Pattern.compile("^" + Pattern.quote(prefix));
            return normalizer(tag -> leading.matcher(tag).replaceFirst(""));
        }

        public Builder homepage(String homepage) {
            this.homepage = homepage;
            return this;
        }

        public Builder releasesUrl(String releasesUrl) {
            this.releasesUrl = releasesUrl;
            return this;
        }

        public Builder license(String name, String url) {
            this.license = new License(name, url);
            return this;
        }

        public DependencyDescriptor build() {
            if (versionKey == null || versionKey.isBlank()) {
                throw new IllegalStateException("Dependency " + name + " has no version key");
            }
            if (fetchSource == null) {
                throw new IllegalStateException("Dependency " + name + " has no fetch source");
            }
            if (sha256Key != null && downloadUrl == null) {
                throw new IllegalStateException("Dependency " + name + " declares " + sha256Key
                        + " but no download URL to verify it against");
            }
            return new DependencyDescriptor(this);
        }
    }
}

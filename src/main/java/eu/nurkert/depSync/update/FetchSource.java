package eu.nurkert.depSync.update;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Where the latest version of a dependency is looked up. Exactly one variant applies
 * per dependency.
 * <p>
 * Dispatch goes through {@link Visitor}, so a new registry kind does not compile until
 * every dispatch site handles it.
 */
public interface FetchSource {

    <R> R accept(Visitor<R> visitor);

    /**
     * Short identifier used in logs, e.g. {@code github}.
     */
    String type();

    static Static pinned(String version) {
        return new Static(version);
    }

    static GitHubTags github(String repo, Pattern tagPattern) {
        return new GitHubTags(repo, tagPattern);
    }

    static GitLabTags gitlab(String host, String project, Pattern tagPattern) {
        return new GitLabTags(host, project, tagPattern);
    }

    static BitBucketTags bitbucket(String repo, Pattern tagPattern) {
        return new BitBucketTags(repo, tagPattern);
    }

    /**
     * A fixed pin, for dependencies that track a branch or are updated by hand.
     */
    record Static(String version) implements FetchSource {
        public Static {
            Objects.requireNonNull(version, "version");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatic(this);
        }

        @Override
        public String type() {
            return "static";
        }
    }

    /**
     * Tags of a GitHub repository given as {@code owner/name}.
     */
    record GitHubTags(String repo, Pattern tagPattern) implements FetchSource {
        public GitHubTags {
            Objects.requireNonNull(repo, "repo");
            Objects.requireNonNull(tagPattern, "tagPattern");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGitHub(this);
        }

        @Override
        public String type() {
            return "github";
        }
    }

    /**
     * Tags of a project on a GitLab instance, e.g. {@code code.videolan.org} and
     * {@code videolan/dav1d}.
     */
    record GitLabTags(String host, String project, Pattern tagPattern) implements FetchSource {
        public GitLabTags {
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(project, "project");
            Objects.requireNonNull(tagPattern, "tagPattern");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGitLab(this);
        }

        @Override
        public String type() {
            return "gitlab";
        }
    }

    /**
     * Tags of a BitBucket repository given as {@code workspace/name}.
     */
    record BitBucketTags(String repo, Pattern tagPattern) implements FetchSource {
        public BitBucketTags {
            Objects.requireNonNull(repo, "repo");
            Objects.requireNonNull(tagPattern, "tagPattern");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBitBucket(this);
        }

        @Override
        public String type() {
            return "bitbucket";
        }
    }

    interface Visitor<R> {
        R visitStatic(Static source);

        R visitGitHub(GitHubTags source);

        R visitGitLab(GitLabTags source);

        R visitBitBucket(BitBucketTags source);
    }
}

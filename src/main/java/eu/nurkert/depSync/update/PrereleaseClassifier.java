package eu.nurkert.depSync.update;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic that recognises non-stable tags such as {@code v1.2.3-rc1}, {@code n8.1-dev},
 * {@code openssl-3.4.0-alpha1} or {@code v1.0.0+build123}.
 * <p>
 * Only the text following the numeric version is inspected. This is not a SemVer parser.
 */
public class PrereleaseClassifier {

    private static final Pattern NUMERIC_VERSION = Pattern.compile("^[0-9]+(?:[.-][0-9]+)*");
    private static final Pattern PRERELEASE_SUFFIX = Pattern.compile(
            "^[-._]?(?:rc|alpha|beta|dev|pre|snapshot)[0-9]*(?:$|[^a-z].*)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public boolean isPrerelease(String tag) {
        if (tag == null) {
            return false;
        }
        String stripped = VersionComparator.stripKnownPrefix(tag.trim());
        Matcher numeric = NUMERIC_VERSION.matcher(stripped);
        if (!numeric.find()) {
            return false;
        }
        String suffix = stripped.substring(numeric.end());
        if (suffix.isEmpty()) {
            return false;
        }
        return suffix.startsWith("+") || PRERELEASE_SUFFIX.matcher(suffix).matches();
    }
}

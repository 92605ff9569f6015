package eu.nurkert.depSync.update;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Orders version strings as published by the tracked registries, e.g. {@code v1.5.2},
 * {@code n8.0.1}, {@code nasm-2.16.03} or {@code openssl-3.4.0}.
 * <p>
 * A known prefix is stripped, the remainder is split on {@code .} and {@code -} and the
 * segments are compared numerically from left to right. Missing segments count as
 * {@code 0}, so {@code 1.0} equals {@code 1.0.0}. A segment without leading digits
 * counts as {@code 0} as well; {@code 1.abc} therefore equals {@code 1.0}. The empty
 * string sorts before everything else.
 */
public class VersionComparator implements Comparator<String> {

    private static final Pattern KNOWN_PREFIX = Pattern.compile("^(?:nasm-|openssl-|v|n)");
    private static final Pattern SEPARATOR = Pattern.compile("[.-]");

    /**
     * @return {@code -1}, {@code 0} or {@code 1}
     */
    @Override
    public int compare(String version1, String version2) {
        String left = version1 == null ? "" : version1.trim();
        String right = version2 == null ? "" : version2.trim();
        if (left.isEmpty() || right.isEmpty()) {
            return Integer.signum(Boolean.compare(!left.isEmpty(), !right.isEmpty()));
        }

        List<String> parts1 = segments(left);
        List<String> parts2 = segments(right);
        int length = Math.max(parts1.size(), parts2.size());

        for (int i = 0; i < length; i++) {
            String v1 = i < parts1.size() ? parts1.get(i) : "0";
            String v2 = i < parts2.size() ? parts2.get(i) : "0";
            int result = compareNumeric(v1, v2);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    /**
     * Removes one leading {@code v}, {@code n}, {@code nasm-} or {@code openssl-}.
     */
    public static String stripKnownPrefix(String version) {
        return KNOWN_PREFIX.matcher(version).replaceFirst("");
    }

    private static List<String> segments(String version) {
        String[] raw = SEPARATOR.split(stripKnownPrefix(version), -1);
        List<String> segments = new ArrayList<>(raw.length);
        for (String segment : raw) {
            segments.add(leadingDigits(segment));
        }
        return segments;
    }

    /**
     * Reduces a segment to its leading digits without leading zeros; {@code "0"} when
     * there are none.
     */
    private static String leadingDigits(String segment) {
        int end = 0;
        while (end < segment.length() && Character.isDigit(segment.charAt(end)) && segment.charAt(end) < 128) {
            end++;
        }
        int start = 0;
        while (start < end - 1 && segment.charAt(start) == '0') {
            start++;
        }
        return end == 0 ? "0" : segment.substring(start, end);
    }

    // Both arguments are canonical digit strings, so longer means larger.
    private static int compareNumeric(String v1, String v2) {
        if (v1.length() != v2.length()) {
            return v1.length() < v2.length() ? -1 : 1;
        }
        return Integer.signum(v1.compareTo(v2));
    }
}

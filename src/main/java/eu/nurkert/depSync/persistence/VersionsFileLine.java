package eu.nurkert.depSync.persistence;

import java.util.Objects;

/**
 * One physical line of a versions file together with its terminator.
 *
 * @param kind       classification of the line
 * @param raw        line content without the terminator
 * @param terminator {@code "\n"}, {@code "\r\n"}, {@code "\r"} or {@code ""} for a last line
 *                   without newline
 * @param key        trimmed key for {@link Kind#KEY_VALUE} lines, otherwise {@code null}
 * @param indent     leading whitespace for {@link Kind#KEY_VALUE} lines, otherwise {@code null}
 */
public record VersionsFileLine(Kind kind, String raw, String terminator, String key, String indent) {

    public enum Kind {
        COMMENT,
        BLANK,
        KEY_VALUE,
        /**
         * Non-blank, non-comment line without {@code =} or with an empty key. Kept verbatim.
         */
        MALFORMED
    }

    public VersionsFileLine {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(terminator, "terminator");
        if (kind == Kind.KEY_VALUE && (key == null || indent == null)) {
            throw new IllegalArgumentException("Key/value line needs a key and an indent: " + raw);
        }
    }

    static VersionsFileLine classify(String raw, String terminator) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return new VersionsFileLine(Kind.BLANK, raw, terminator, null, null);
        }
        if (trimmed.startsWith("#")) {
            return new VersionsFileLine(Kind.COMMENT, raw, terminator, null, null);
        }
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex < 0) {
            return new VersionsFileLine(Kind.MALFORMED, raw, terminator, null, null);
        }
        String key = raw.substring(0, equalsIndex).trim();
        if (key.isEmpty()) {
            return new VersionsFileLine(Kind.MALFORMED, raw, terminator, null, null);
        }
        return new VersionsFileLine(Kind.KEY_VALUE, raw, terminator, key, leadingWhitespace(raw));
    }

    /**
     * Value with surrounding whitespace removed; {@code =} inside the value is kept.
     */
    public String value() {
        if (kind != Kind.KEY_VALUE) {
            return null;
        }
        return raw.substring(raw.indexOf('=') + 1).trim();
    }

    /**
     * Returns this line rewritten as {@code <indent><key>=<newValue>}.
     */
    public VersionsFileLine withValue(String newValue) {
        if (kind != Kind.KEY_VALUE) {
            throw new IllegalStateException("Only key/value lines carry a value: " + raw);
        }
        return new VersionsFileLine(kind, indent + key + "=" + newValue, terminator, key, indent);
    }

    public VersionsFileLine withRaw(String newRaw) {
        return classify(newRaw, terminator);
    }

    private static String leadingWhitespace(String raw) {
        int end = 0;
        while (end < raw.length() && isInlineWhitespace(raw.charAt(end))) {
            end++;
        }
        return raw.substring(0, end);
    }

    private static boolean isInlineWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }
}

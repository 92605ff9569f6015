package eu.nurkert.depSync.persistence;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory form of a {@code versions.properties} file. Every line is kept together with its
 * terminator so that {@link #render(Map, LocalDate)} can reproduce untouched lines exactly.
 */
public final class VersionsFile {

    public static final String TIMESTAMP_PREFIX = "# Updated:";

    private static final Pattern TIMESTAMP_DATE = Pattern.compile("^# Updated:\\s*(\\d{4}-\\d{2}-\\d{2})");

    private final List<VersionsFileLine> lines;

    private VersionsFile(List<VersionsFileLine> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static VersionsFile parse(String content) {
        Objects.requireNonNull(content, "content");
        List<VersionsFileLine> lines = new ArrayList<>();
        int start = 0;
        int length = content.length();
        while (start < length) {
            int end = start;
            while (end < length && content.charAt(end) != '\n' && content.charAt(end) != '\r') {
                end++;
            }
            String raw = content.substring(start, end);
            String terminator;
            if (end >= length) {
                terminator = "";
            } else if (content.charAt(end) == '\r' && end + 1 < length && content.charAt(end + 1) == '\n') {
                terminator = "\r\n";
            } else {
                terminator = String.valueOf(content.charAt(end));
            }
            lines.add(VersionsFileLine.classify(raw, terminator));
            start = end + terminator.length();
        }
        return new VersionsFile(lines);
    }

    public List<VersionsFileLine> getLines() {
        return lines;
    }

    /**
     * Key/value pairs in file order. A key that occurs more than once keeps its last value.
     */
    public Map<String, String> toMap() {
        Map<String, String> values = new LinkedHashMap<>();
        for (VersionsFileLine line : lines) {
            if (line.kind() == VersionsFileLine.Kind.KEY_VALUE) {
                values.put(line.key(), line.value());
            }
        }
        return values;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(toMap().get(key));
    }

    /**
     * Date carried by the {@code # Updated:} comment, if there is one and it parses.
     */
    public Optional<String> timestamp() {
        for (VersionsFileLine line : lines) {
            Matcher matcher = TIMESTAMP_DATE.matcher(line.raw());
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Produces the file content with {@code updates} applied. Keys that do not occur in the
     * file are ignored. The timestamp comment is set to {@code today}.
     */
    public String render(Map<String, String> updates, LocalDate today) {
        Objects.requireNonNull(updates, "updates");
        String stamp = TIMESTAMP_PREFIX + " " + today.format(DateTimeFormatter.ISO_LOCAL_DATE);
        StringBuilder out = new StringBuilder();
        for (VersionsFileLine line : lines) {
            VersionsFileLine emitted = line;
            if (line.raw().startsWith(TIMESTAMP_PREFIX)) {
                emitted = line.withRaw(stamp);
            } else if (line.kind() == VersionsFileLine.Kind.KEY_VALUE && updates.containsKey(line.key())) {
                emitted = line.withValue(updates.get(line.key()));
            }
            out.append(emitted.raw()).append(emitted.terminator());
        }
        return out.toString();
    }

    /**
     * The original content, unchanged.
     */
    public String content() {
        StringBuilder out = new StringBuilder();
        for (VersionsFileLine line : lines) {
            out.append(line.raw()).append(line.terminator());
        }
        return out.toString();
    }
}

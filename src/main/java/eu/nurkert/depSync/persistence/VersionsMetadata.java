package eu.nurkert.depSync.persistence;

/**
 * Summary values read from a versions file for display purposes.
 *
 * @param lastUpdated   date from the {@code # Updated:} comment, today when there is none
 * @param ffmpegVersion FFmpeg version without its {@code n} prefix, {@code unknown} when absent
 */
public record VersionsMetadata(String lastUpdated, String ffmpegVersion) {

    public static final String UNKNOWN = "unknown";
}

package eu.nurkert.depSync.handlers;

import java.io.IOException;

/**
 * The artifact of an updated dependency could not be downloaded and hashed. The version
 * bump itself is still valid; only its checksum is missing.
 */
public class ChecksumDownloadException extends IOException {

    private final String url;

    public ChecksumDownloadException(String url, Throwable cause) {
        super("Failed to download " + url + " for checksum verification"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}

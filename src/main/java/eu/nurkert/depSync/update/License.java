package eu.nurkert.depSync.update;

import java.util.Objects;

/**
 * SPDX-style license name plus a link to the license text.
 */
public record License(String name, String url) {
    public License {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }
}

package eu.nurkert.depSync.handlers;

import eu.nurkert.depSync.net.HttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the SHA-256 of a release artifact while streaming it, without keeping the
 * payload in memory or on disk.
 */
public class ChecksumVerifier {

    public static final String ALGORITHM = "SHA-256";

    private static final Logger LOGGER = Logger.getLogger(ChecksumVerifier.class.getName());

    private final HttpClient httpClient;

    public ChecksumVerifier(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * @return the lowercase hex encoded digest of the body served at {@code url}
     * @throws ChecksumDownloadException if the download fails after retries
     */
    public String checksum(String url) throws ChecksumDownloadException {
        MessageDigest digest = createDigest();
        long bytes;
        try (InputStream body = httpClient.openStream(url);
             DigestInputStream digestStream = new DigestInputStream(body, digest)) {
            bytes = digestStream.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            throw new ChecksumDownloadException(url, e);
        }
        String hex = HexFormat.of().formatHex(digest.digest());
        LOGGER.log(Level.FINE, "Hashed {0} bytes from {1}: {2}", new Object[]{bytes, url, hex});
        return hex;
    }

    private static MessageDigest createDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship SHA-256.
            throw new IllegalStateException("Unsupported checksum algorithm: " + ALGORITHM, e);
        }
    }
}

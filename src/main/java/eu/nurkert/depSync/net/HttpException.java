package eu.nurkert.depSync.net;

import java.io.IOException;

/**
 * Exception thrown when an HTTP request returns a non-successful status code.
 */
public class HttpException extends IOException {

    private final String url;
    private final int statusCode;
    private final String responseBody;

    public HttpException(String url, int statusCode, String responseBody) {
        super("HTTP " + statusCode + ": " + url);
        this.url = url;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}

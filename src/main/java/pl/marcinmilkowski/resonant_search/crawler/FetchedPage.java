package pl.marcinmilkowski.resonant_search.crawler;

import java.util.Locale;

/**
 * Raw HTTP response of a page fetch.
 *
 * @param url         final URL after redirects
 * @param statusCode  HTTP status
 * @param contentType Content-Type header, may be null
 * @param body        response body decoded as text
 */
public record FetchedPage(String url, int statusCode, String contentType, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isHtml() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
    }
}

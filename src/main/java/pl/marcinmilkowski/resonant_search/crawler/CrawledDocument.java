package pl.marcinmilkowski.resonant_search.crawler;

import java.util.Objects;

/**
 * A fetched and parsed page handed to the ranking engine through the ingestion channel.
 */
public record CrawledDocument(String url, String title, String text) {

    public CrawledDocument {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(text, "text");
    }
}

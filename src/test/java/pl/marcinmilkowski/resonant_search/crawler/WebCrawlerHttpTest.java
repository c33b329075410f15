package pl.marcinmilkowski.resonant_search.crawler;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end crawl against an in-process HTTP server with the jsoup fetcher.
 */
class WebCrawlerHttpTest {

    private HttpServer server;
    private String base;

    private static final Map<String, String> PAGES = Map.of(
        "/", "<html><head><title>Home</title></head><body><p>prime resonance home</p>"
            + "<a href=\"/about\">about</a> <a href=\"/private/secret\">secret</a>"
            + " <a href=\"/file.txt\">file</a></body></html>",
        "/about", "<html><head><title>About</title></head><body><p>about the engine</p>"
            + "<a href=\"/#top\">home</a></body></html>",
        "/private/secret", "<html><body>secret</body></html>");

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        int status = 200;
        String contentType = "text/html; charset=utf-8";
        String body;
        if (path.equals("/robots.txt")) {
            contentType = "text/plain";
            body = "User-agent: *\nDisallow: /private\n";
        } else if (path.equals("/file.txt")) {
            contentType = "text/plain";
            body = "plain text";
        } else if (PAGES.containsKey(path)) {
            body = PAGES.get(path);
        } else {
            status = 404;
            body = "not found";
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("Crawl over HTTP honours robots.txt and content types")
    void testCrawlOverHttp() throws InterruptedException {
        CrawlerConfig config = CrawlerConfig.builder()
            .crawlDelayMillis(0)
            .workers(2)
            .timeoutMillis(5000)
            .idleGraceMillis(50)
            .build();
        IngestionChannel channel = new IngestionChannel(10);

        CrawlStatistics stats = new WebCrawler(config, channel).crawl(List.of(base + "/"));
        channel.close();

        List<CrawledDocument> docs = new ArrayList<>();
        CrawledDocument doc;
        while ((doc = channel.receive(0, TimeUnit.MILLISECONDS)) != null) {
            docs.add(doc);
        }

        assertEquals(2, docs.size());
        assertEquals(2, stats.getEmitted());
        assertEquals(1, stats.getRobotsDenied());
        assertEquals(1, stats.getSkipped());
        CrawledDocument home = docs.stream().filter(d -> d.url().equals(base + "/")).findFirst().orElseThrow();
        assertEquals("Home", home.title());
        assertTrue(home.text().contains("prime resonance home"));
    }
}

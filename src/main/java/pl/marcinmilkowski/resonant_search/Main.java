package pl.marcinmilkowski.resonant_search;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.resonant_search.config.ResonantConfigLoader;
import pl.marcinmilkowski.resonant_search.crawler.CrawlStatistics;
import pl.marcinmilkowski.resonant_search.crawler.CrawlerConfig;
import pl.marcinmilkowski.resonant_search.crawler.IngestionChannel;
import pl.marcinmilkowski.resonant_search.crawler.WebCrawler;
import pl.marcinmilkowski.resonant_search.engine.DocumentIngestor;
import pl.marcinmilkowski.resonant_search.engine.LocalDocumentLoader;
import pl.marcinmilkowski.resonant_search.engine.RankingEngine;
import pl.marcinmilkowski.resonant_search.engine.SearchResult;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: crawl or index local files, then optionally search.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int DEFAULT_LIMIT = 10;

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "crawl":
                    handleCrawlCommand(args);
                    break;
                case "index":
                    handleIndexCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleCrawlCommand(String[] args) throws IOException, InterruptedException {
        List<String> seeds = new ArrayList<>();
        String configFile = null;
        boolean stayInDomain = false;
        String query = null;
        int limit = DEFAULT_LIMIT;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--seed":
                case "-s":
                    seeds.add(args[++i]);
                    break;
                case "--config":
                case "-c":
                    configFile = args[++i];
                    break;
                case "--stay-in-domain":
                    stayInDomain = true;
                    break;
                case "--query":
                case "-q":
                    query = args[++i];
                    break;
                case "--limit":
                    limit = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (seeds.isEmpty()) {
            System.err.println("Error: at least one --seed is required");
            System.err.println("Usage: java -jar resonant-search.jar crawl --seed <url> [--seed <url>...]");
            return;
        }

        ResonantConfigLoader config = loadConfig(configFile);
        CrawlerConfig crawlerConfig = config.crawlerConfig();
        if (stayInDomain) {
            crawlerConfig = crawlerConfig.toBuilder().allowedDomains(WebCrawler.seedDomains(seeds)).build();
        }

        RankingEngine engine = new RankingEngine(config.rankingConfig());
        IngestionChannel channel = new IngestionChannel(crawlerConfig.channelCapacity());
        DocumentIngestor ingestor = new DocumentIngestor(engine, channel);
        ingestor.start();

        WebCrawler crawler = new WebCrawler(crawlerConfig, channel);
        CrawlStatistics stats;
        try {
            stats = crawler.crawl(seeds);
        } finally {
            channel.close();
        }
        ingestor.awaitCompletion(1, TimeUnit.MINUTES);
        engine.refreshRelationships();

        JSONObject summary = new JSONObject();
        summary.put("emitted", stats.getEmitted());
        summary.put("skipped", stats.getSkipped());
        summary.put("failed", stats.getFailed());
        summary.put("robots_denied", stats.getRobotsDenied());
        summary.put("indexed", engine.size());
        System.out.println(summary.toJSONString(JSONWriter.Feature.PrettyFormat));

        if (query != null) {
            printResults(engine.search(query, limit));
        }
    }

    private static void handleIndexCommand(String[] args) throws IOException {
        String dir = null;
        String configFile = null;
        String query = null;
        int limit = DEFAULT_LIMIT;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--dir":
                case "-d":
                    dir = args[++i];
                    break;
                case "--config":
                case "-c":
                    configFile = args[++i];
                    break;
                case "--query":
                case "-q":
                    query = args[++i];
                    break;
                case "--limit":
                    limit = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (dir == null) {
            System.err.println("Error: --dir is required");
            System.err.println("Usage: java -jar resonant-search.jar index --dir <path>");
            return;
        }

        ResonantConfigLoader config = loadConfig(configFile);
        RankingEngine engine = new RankingEngine(config.rankingConfig());
        int added = new LocalDocumentLoader(engine).loadDirectory(Paths.get(dir));
        engine.refreshRelationships();
        System.out.println("Indexed " + added + " documents from " + dir);

        if (query != null) {
            printResults(engine.search(query, limit));
        }
    }

    private static ResonantConfigLoader loadConfig(String configFile) throws IOException {
        return configFile == null
            ? ResonantConfigLoader.loadDefault()
            : new ResonantConfigLoader(Paths.get(configFile));
    }

    private static void printResults(List<SearchResult> results) {
        System.out.println(JSON.toJSONString(results, JSONWriter.Feature.PrettyFormat));
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar resonant-search.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  crawl   Crawl from seed URLs and index the pages");
        System.out.println("          --seed, -s <url>     Seed URL (repeatable, required)");
        System.out.println("          --config, -c <file>  JSON configuration");
        System.out.println("          --stay-in-domain     Only follow links on the seed hosts");
        System.out.println("          --query, -q <text>   Search after crawling");
        System.out.println("          --limit <k>          Number of results (default 10)");
        System.out.println();
        System.out.println("  index   Index .txt and .html files from a directory");
        System.out.println("          --dir, -d <path>     Directory to walk (required)");
        System.out.println("          --config, -c <file>  JSON configuration");
        System.out.println("          --query, -q <text>   Search after indexing");
        System.out.println("          --limit <k>          Number of results (default 10)");
        System.out.println();
        System.out.println("  help    Show this message");
    }
}

package pl.marcinmilkowski.resonant_search.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.resonant_search.crawler.CrawlerConfig;
import pl.marcinmilkowski.resonant_search.engine.RankingConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads ranking and crawler settings from JSON.
 *
 * Expected JSON structure (every key optional, absent keys keep defaults):
 * {
 *   "ranking": {
 *     "use_quantum_score": true,
 *     "use_persistence_score": true,
 *     "entropy_weight": 0.1,
 *     "fragility": 0.2,
 *     "trend_decay": 0.05,
 *     "update_frequency": 0.1,
 *     "dense_dimension": 8192,
 *     "snippet_length": 200
 *   },
 *   "crawler": {
 *     "max_pages": 10000,
 *     "max_depth": 3,
 *     "crawl_delay": 500,
 *     "respect_noindex": true,
 *     "respect_nofollow": true,
 *     "allowed_domains": ["example.com"],
 *     "max_concurrent_requests": 10,
 *     "workers": 10,
 *     "user_agent": "ResonantSearchBot/1.0",
 *     "timeout_ms": 30000,
 *     "channel_capacity": 100
 *   }
 * }
 * crawl_delay is in milliseconds.
 */
public class ResonantConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ResonantConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "resonant-search.json";

    private final RankingConfig rankingConfig;
    private final CrawlerConfig crawlerConfig;

    /**
     * Load configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public ResonantConfigLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    ResonantConfigLoader(String content, String source) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty configuration in " + source);
        }
        this.rankingConfig = parseRanking(root.getJSONObject("ranking"));
        this.crawlerConfig = parseCrawler(root.getJSONObject("crawler"));
        logger.info("Loaded configuration from {}", source);
    }

    /**
     * Configuration bundled on the classpath.
     */
    public static ResonantConfigLoader loadDefault() throws IOException {
        try (InputStream in = ResonantConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled config not found: " + DEFAULT_RESOURCE);
            }
            return new ResonantConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        }
    }

    public RankingConfig rankingConfig() {
        return rankingConfig;
    }

    public CrawlerConfig crawlerConfig() {
        return crawlerConfig;
    }

    private static String readFile(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        return Files.readString(configPath);
    }

    static RankingConfig parseRanking(JSONObject obj) {
        RankingConfig.Builder builder = RankingConfig.builder();
        if (obj == null) {
            return builder.build();
        }
        if (obj.containsKey("use_quantum_score")) {
            builder.useQuantumScore(obj.getBooleanValue("use_quantum_score"));
        }
        if (obj.containsKey("use_persistence_score")) {
            builder.usePersistenceScore(obj.getBooleanValue("use_persistence_score"));
        }
        if (obj.containsKey("entropy_weight")) {
            builder.entropyWeight(obj.getDoubleValue("entropy_weight"));
        }
        if (obj.containsKey("fragility")) {
            builder.fragility(obj.getDoubleValue("fragility"));
        }
        if (obj.containsKey("trend_decay")) {
            builder.trendDecay(obj.getDoubleValue("trend_decay"));
        }
        if (obj.containsKey("update_frequency")) {
            builder.updateFrequency(obj.getDoubleValue("update_frequency"));
        }
        if (obj.containsKey("dense_dimension")) {
            builder.denseDimension(obj.getIntValue("dense_dimension"));
        }
        if (obj.containsKey("snippet_length")) {
            builder.snippetLength(obj.getIntValue("snippet_length"));
        }
        return builder.build();
    }

    static CrawlerConfig parseCrawler(JSONObject obj) {
        CrawlerConfig.Builder builder = CrawlerConfig.builder();
        if (obj == null) {
            return builder.build();
        }
        if (obj.containsKey("max_pages")) {
            builder.maxPages(obj.getIntValue("max_pages"));
        }
        if (obj.containsKey("max_depth")) {
            builder.maxDepth(obj.getIntValue("max_depth"));
        }
        if (obj.containsKey("crawl_delay")) {
            builder.crawlDelayMillis(obj.getLongValue("crawl_delay"));
        }
        if (obj.containsKey("respect_noindex")) {
            builder.respectNoindex(obj.getBooleanValue("respect_noindex"));
        }
        if (obj.containsKey("respect_nofollow")) {
            builder.respectNofollow(obj.getBooleanValue("respect_nofollow"));
        }
        JSONArray domains = obj.getJSONArray("allowed_domains");
        if (domains != null) {
            List<String> hosts = new ArrayList<>();
            for (int i = 0; i < domains.size(); i++) {
                hosts.add(domains.getString(i));
            }
            builder.allowedDomains(hosts);
        }
        if (obj.containsKey("max_concurrent_requests")) {
            builder.maxConcurrentRequests(obj.getIntValue("max_concurrent_requests"));
        }
        if (obj.containsKey("workers")) {
            builder.workers(obj.getIntValue("workers"));
        }
        if (obj.containsKey("user_agent")) {
            builder.userAgent(obj.getString("user_agent"));
        }
        if (obj.containsKey("timeout_ms")) {
            builder.timeoutMillis(obj.getIntValue("timeout_ms"));
        }
        if (obj.containsKey("channel_capacity")) {
            builder.channelCapacity(obj.getIntValue("channel_capacity"));
        }
        return builder.build();
    }
}

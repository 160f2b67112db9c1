package net.papermentat.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Strongly typed configuration for the resolution pipeline.
 */
@Component
@ConfigurationProperties(prefix = "papermentat")
public class PaperMentatProperties {

    private static final double MIN_RATE_LIMIT = 0.1;

    /**
     * Maximum outbound requests per second across all providers.
     */
    private double rateLimitPerSecond = 1.0;

    /**
     * Per-request timeout for provider calls and artifact downloads.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * User-Agent sent to every provider; the scholarly APIs ask for a contact address in it.
     */
    private String userAgent = "PaperMentat/0.1 (mailto:unknown@example.org)";

    /**
     * Contact address for the OA-status index and the polite pools. Empty disables the OA-status index.
     */
    private String contactEmail = "";

    /**
     * API key for the full-text repository index. Empty disables it.
     */
    private String coreApiKey = "";

    /**
     * Directory receiving JSON exports and downloaded artifacts.
     */
    private Path outputDir = Path.of("results");

    /**
     * Topics searched when the runner is started without a query.
     */
    private List<String> topicsOfInterest = new ArrayList<>();

    private final Http http = new Http();

    private final OaCache oaCache = new OaCache();

    private final Enrichment enrichment = new Enrichment();

    @PostConstruct
    void validate() {
        Assert.isTrue(rateLimitPerSecond > 0, "papermentat.rate-limit-per-second must be positive");
        Assert.isTrue(timeout != null && !timeout.isNegative() && !timeout.isZero(), "papermentat.timeout must be positive");
        Assert.isTrue(http.maxRetries >= 0, "papermentat.http.max-retries must be non-negative");
        Assert.isTrue(!http.retryWait.isNegative(), "papermentat.http.retry-wait must be non-negative");
        Assert.isTrue(http.maxInMemorySize > 0, "papermentat.http.max-in-memory-size must be positive");
        Assert.isTrue(oaCache.maxSize >= 0, "papermentat.oa-cache.max-size must be non-negative");
        Assert.isTrue(!oaCache.ttl.isNegative(), "papermentat.oa-cache.ttl must be non-negative");
        Assert.isTrue(List.of("none", "ollama", "openai").contains(enrichment.provider),
            "papermentat.enrichment.provider must be one of none, ollama, openai");
    }

    /**
     * Effective rate limit, floored so the throttle interval stays bounded.
     */
    public double effectiveRateLimit() {
        return Math.max(rateLimitPerSecond, MIN_RATE_LIMIT);
    }

    public double getRateLimitPerSecond() {
        return rateLimitPerSecond;
    }

    public void setRateLimitPerSecond(double rateLimitPerSecond) {
        this.rateLimitPerSecond = rateLimitPerSecond;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getContactEmail() {
        return contactEmail;
    }

    public void setContactEmail(String contactEmail) {
        this.contactEmail = contactEmail != null ? contactEmail.trim() : "";
    }

    public String getCoreApiKey() {
        return coreApiKey;
    }

    public void setCoreApiKey(String coreApiKey) {
        this.coreApiKey = coreApiKey != null ? coreApiKey.trim() : "";
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir != null ? outputDir : Path.of("results");
    }

    public List<String> getTopicsOfInterest() {
        return topicsOfInterest;
    }

    public void setTopicsOfInterest(List<String> topicsOfInterest) {
        this.topicsOfInterest = topicsOfInterest != null ? new ArrayList<>(topicsOfInterest) : new ArrayList<>();
    }

    public Http getHttp() {
        return http;
    }

    public OaCache getOaCache() {
        return oaCache;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    /**
     * Retry and buffer settings for the shared gateway.
     */
    public static class Http {

        /**
         * Retries after the first attempt for transient failures (5xx, 429, transport errors).
         */
        private int maxRetries = 3;

        private Duration retryWait = Duration.ofMillis(500);

        /**
         * Largest response body buffered in memory; PDFs are the big ones.
         */
        private int maxInMemorySize = 50 * 1024 * 1024;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryWait() {
            return retryWait;
        }

        public void setRetryWait(Duration retryWait) {
            this.retryWait = retryWait != null ? retryWait : Duration.ofMillis(500);
        }

        public int getMaxInMemorySize() {
            return maxInMemorySize;
        }

        public void setMaxInMemorySize(int maxInMemorySize) {
            this.maxInMemorySize = maxInMemorySize;
        }
    }

    public static class OaCache {

        private long maxSize = 10_000;

        private Duration ttl = Duration.ofHours(12);

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl != null ? ttl : Duration.ofHours(12);
        }
    }

    /**
     * Optional LLM-backed metadata enrichment for generic URLs.
     */
    public static class Enrichment {

        /**
         * One of {@code none}, {@code ollama}, {@code openai}.
         */
        private String provider = "none";

        private final Ollama ollama = new Ollama();

        private final OpenAi openai = new OpenAi();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider != null ? provider.trim().toLowerCase(Locale.ROOT) : "none";
        }

        public Ollama getOllama() {
            return ollama;
        }

        public OpenAi getOpenai() {
            return openai;
        }
    }

    public static class Ollama {

        private String baseUrl = "http://localhost:11434";

        private String model = "llama3.1";

        private Duration timeout = Duration.ofSeconds(120);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout != null ? timeout : Duration.ofSeconds(120);
        }
    }

    public static class OpenAi {

        private String apiKey = "";

        private String baseUrl = "https://api.openai.com/v1";

        private String model = "gpt-4o-mini";

        private Duration timeout = Duration.ofSeconds(60);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey != null ? apiKey.trim() : "";
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout != null ? timeout : Duration.ofSeconds(60);
        }
    }
}

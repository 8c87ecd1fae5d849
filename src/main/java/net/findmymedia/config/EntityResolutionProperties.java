package net.findmymedia.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Strongly typed configuration for the entity resolution pipeline.
 */
@Component
@ConfigurationProperties(prefix = "app.resolution")
public class EntityResolutionProperties {

    public static final String DEFAULT_USER_AGENT = "FindMyMediaBot/1.0 (+https://findmymedia.net)";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(30_000);

    /**
     * User-Agent header sent to every upstream.
     */
    private String userAgent = DEFAULT_USER_AGENT;

    /**
     * Per-stage network timeout.
     */
    private Duration timeout = DEFAULT_TIMEOUT;

    private final Wikidata wikidata = new Wikidata();
    private final OpenLibrary openLibrary = new OpenLibrary();
    private final Google google = new Google();
    private final Ai ai = new Ai();
    private final Heuristics heuristics = new Heuristics();
    private final Cache cache = new Cache();

    @PostConstruct
    void validate() {
        Assert.isTrue(timeout != null && !timeout.isNegative() && !timeout.isZero(),
            "app.resolution.timeout must be positive");
        Assert.isTrue(cache.maxSize > 0, "app.resolution.cache.max-size must be positive");
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent != null && !userAgent.isBlank() ? userAgent : DEFAULT_USER_AGENT;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public Wikidata getWikidata() {
        return wikidata;
    }

    public OpenLibrary getOpenLibrary() {
        return openLibrary;
    }

    public Google getGoogle() {
        return google;
    }

    public Ai getAi() {
        return ai;
    }

    public Heuristics getHeuristics() {
        return heuristics;
    }

    public Cache getCache() {
        return cache;
    }

    public static class Wikidata {
        private boolean enabled = true;
        private String endpoint = "https://query.wikidata.org/sparql";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }
    }

    public static class OpenLibrary {
        private boolean enabled = true;
        private String baseUrl = "https://openlibrary.org";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    /**
     * Google Programmable Search credentials. The stage is skipped unless both are set.
     */
    public static class Google {
        private String endpoint = "https://www.googleapis.com/customsearch/v1";
        private String apiKey = "";
        private String searchEngineId = "";

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getSearchEngineId() {
            return searchEngineId;
        }

        public void setSearchEngineId(String searchEngineId) {
            this.searchEngineId = searchEngineId;
        }
    }

    /**
     * OpenAI-compatible chat completion endpoint used by the classifier.
     */
    public static class Ai {
        private String apiKey = "";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
        private String model = "gemini-2.5-flash";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
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
    }

    public static class Heuristics {
        /**
         * Words removed from a query before title matching because they only hint at the category.
         */
        private List<String> categoryHintWords = List.of("film", "book", "movie", "tv", "series", "game", "album", "song");

        public List<String> getCategoryHintWords() {
            return categoryHintWords;
        }

        public void setCategoryHintWords(List<String> categoryHintWords) {
            this.categoryHintWords = categoryHintWords != null ? List.copyOf(categoryHintWords) : List.of();
        }
    }

    public static class Cache {
        /**
         * memory, filesystem or none.
         */
        private String type = "memory";
        private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "findmymedia-cache");
        private int maxSize = 10_000;
        private Duration ttl = Duration.ofDays(7);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl != null ? ttl : Duration.ofDays(7);
        }
    }
}

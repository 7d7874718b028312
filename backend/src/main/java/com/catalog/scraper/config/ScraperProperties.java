package com.catalog.scraper.config;

import com.catalog.scraper.crawl.pipeline.DiscoveryMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "catalog-scraper/0.1 (+contact)";

    private String userAgent;
    private int workerCount = 4;
    private int queueCapacity = 0;
    private int maxAttempts = 3;
    private int retryBaseDelayMs = 500;
    private int retryMaxDelayMs = 8000;
    private int requestTimeoutSeconds = 60;
    private int perHostConcurrency = 2;
    private int perHostDelayMs = 100;
    private int throttledBackoffMs = 30000;
    private int maxPagesPerCategory = 50;
    private int progressLogSeconds = 10;
    private DiscoveryMode discoveryMode = DiscoveryMode.EAGER;
    private String siteProfile = "books";
    private List<Seed> seeds = new ArrayList<>();
    private Selectors selectors = new Selectors();
    private Output output = new Output();
    private Persist persist = new Persist();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = Math.max(0, queueCapacity);
    }

    /**
     * Capacity used for both the work queue and the result queue. Zero means twice the worker count.
     */
    public int effectiveQueueCapacity() {
        return queueCapacity > 0 ? queueCapacity : 2 * getWorkerCount();
    }

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public int getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getThrottledBackoffMs() {
        return throttledBackoffMs;
    }

    public void setThrottledBackoffMs(int throttledBackoffMs) {
        this.throttledBackoffMs = Math.max(0, throttledBackoffMs);
    }

    public int getMaxPagesPerCategory() {
        return Math.max(1, maxPagesPerCategory);
    }

    public void setMaxPagesPerCategory(int maxPagesPerCategory) {
        this.maxPagesPerCategory = Math.max(1, maxPagesPerCategory);
    }

    public int getProgressLogSeconds() {
        return Math.max(1, progressLogSeconds);
    }

    public void setProgressLogSeconds(int progressLogSeconds) {
        this.progressLogSeconds = Math.max(1, progressLogSeconds);
    }

    public DiscoveryMode getDiscoveryMode() {
        return discoveryMode == null ? DiscoveryMode.EAGER : discoveryMode;
    }

    public void setDiscoveryMode(DiscoveryMode discoveryMode) {
        this.discoveryMode = discoveryMode;
    }

    public String getSiteProfile() {
        return siteProfile == null || siteProfile.isBlank() ? "books" : siteProfile.trim();
    }

    public void setSiteProfile(String siteProfile) {
        this.siteProfile = siteProfile;
    }

    public List<Seed> getSeeds() {
        return seeds;
    }

    public void setSeeds(List<Seed> seeds) {
        this.seeds = seeds == null ? new ArrayList<>() : seeds;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    public void setSelectors(Selectors selectors) {
        this.selectors = selectors;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Persist getPersist() {
        return persist;
    }

    public void setPersist(Persist persist) {
        this.persist = persist;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null) {
            return DEFAULT_USER_AGENT;
        }
        String trimmed = candidate.trim();
        if (trimmed.isEmpty() || trimmed.chars().anyMatch(Character::isISOControl)) {
            return DEFAULT_USER_AGENT;
        }
        return trimmed;
    }

    public static class Seed {
        private String category;
        private String url;

        public Seed() {
        }

        public Seed(String category, String url) {
            this.category = category;
            this.url = url;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class Selectors {
        private String listingLink = "a[href]";
        private String nextLink = "";
        private Map<String, String> fields = new LinkedHashMap<>();
        private List<String> requiredFields = new ArrayList<>();

        public String getListingLink() {
            return listingLink;
        }

        public void setListingLink(String listingLink) {
            this.listingLink = listingLink;
        }

        public String getNextLink() {
            return nextLink;
        }

        public void setNextLink(String nextLink) {
            this.nextLink = nextLink;
        }

        public Map<String, String> getFields() {
            return fields;
        }

        public void setFields(Map<String, String> fields) {
            this.fields = fields == null ? new LinkedHashMap<>() : fields;
        }

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields == null ? new ArrayList<>() : requiredFields;
        }
    }

    public static class Output {
        private String sink = "jdbc";
        private String jsonFile = "books_data.json";
        private String keyField = "";

        public String getSink() {
            return sink == null || sink.isBlank() ? "jdbc" : sink;
        }

        public void setSink(String sink) {
            this.sink = sink;
        }

        public String getJsonFile() {
            return jsonFile;
        }

        public void setJsonFile(String jsonFile) {
            this.jsonFile = jsonFile;
        }

        public String getKeyField() {
            return keyField;
        }

        public void setKeyField(String keyField) {
            this.keyField = keyField;
        }
    }

    public static class Persist {
        private int maxAttempts = 3;
        private int maxConsecutiveFailures = 3;
        private int retryDelayMs = 200;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getMaxConsecutiveFailures() {
            return Math.max(1, maxConsecutiveFailures);
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        }

        public int getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

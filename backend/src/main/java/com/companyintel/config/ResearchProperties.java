package com.companyintel.config;

import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.ProviderRoute;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "research")
public class ResearchProperties {
    private static final String DEFAULT_USER_AGENT = "company-intel/0.1 (+research-bot)";

    private String userAgent;
    private int perHostDelayMs = 200;
    private int globalConcurrency = 16;
    private int perHostConcurrency = 10;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private int maxResponseBytes = 3_000_000;
    private int maxConcurrentRuns = 2;
    private int maxRetainedRuns = 100;
    private Discovery discovery = new Discovery();
    private Prioritization prioritization = new Prioritization();
    private Extraction extraction = new Extraction();
    private Synthesis synthesis = new Synthesis();
    private Render render = new Render();
    private RateLimit rateLimit = new RateLimit();
    private Providers providers = new Providers();
    private Cli cli = new Cli();

    public PipelineConfig toPipelineConfig() {
        Map<CallPurpose, ProviderRoute> routes = new EnumMap<>(CallPurpose.class);
        routes.put(CallPurpose.PAGE_SELECTION, providers.getRoutes().getPageSelection().toRoute());
        routes.put(CallPurpose.SYNTHESIS, providers.getRoutes().getSynthesis().toRoute());
        routes.put(CallPurpose.CLASSIFICATION, providers.getRoutes().getClassification().toRoute());
        routes.put(CallPurpose.EMBEDDING, providers.getRoutes().getEmbedding().toRoute());
        return new PipelineConfig(
            discovery.getMaxLinks(),
            discovery.getMaxCrawlDepth(),
            prioritization.getMaxPrioritizedPages(),
            extraction.getConcurrency(),
            Duration.ofSeconds(extraction.getPerPageTimeoutSeconds()),
            extraction.getGlobalTimeoutSeconds() > 0 ? Duration.ofSeconds(extraction.getGlobalTimeoutSeconds()) : null,
            extraction.getMinSubstantialContentLength(),
            routes
        );
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getMaxResponseBytes() {
        return Math.max(1024, maxResponseBytes);
    }

    public void setMaxResponseBytes(int maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
    }

    public int getMaxConcurrentRuns() {
        return Math.max(1, maxConcurrentRuns);
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    public int getMaxRetainedRuns() {
        return Math.max(1, maxRetainedRuns);
    }

    public void setMaxRetainedRuns(int maxRetainedRuns) {
        this.maxRetainedRuns = Math.max(1, maxRetainedRuns);
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Prioritization getPrioritization() {
        return prioritization;
    }

    public void setPrioritization(Prioritization prioritization) {
        this.prioritization = prioritization;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Synthesis synthesis) {
        this.synthesis = synthesis;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Discovery {
        private int maxLinks = 1000;
        private int maxCrawlDepth = 3;
        private int maxCrawlPages = 60;
        private int maxSitemaps = 10;
        private int maxRobotsSitemaps = 3;
        private boolean robotsFailOpen = true;

        public int getMaxLinks() {
            return Math.max(1, maxLinks);
        }

        public void setMaxLinks(int maxLinks) {
            this.maxLinks = Math.max(1, maxLinks);
        }

        public int getMaxCrawlDepth() {
            return Math.max(0, maxCrawlDepth);
        }

        public void setMaxCrawlDepth(int maxCrawlDepth) {
            this.maxCrawlDepth = Math.max(0, maxCrawlDepth);
        }

        public int getMaxCrawlPages() {
            return Math.max(1, maxCrawlPages);
        }

        public void setMaxCrawlPages(int maxCrawlPages) {
            this.maxCrawlPages = Math.max(1, maxCrawlPages);
        }

        public int getMaxSitemaps() {
            return Math.max(1, maxSitemaps);
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = Math.max(1, maxSitemaps);
        }

        public int getMaxRobotsSitemaps() {
            return Math.max(1, maxRobotsSitemaps);
        }

        public void setMaxRobotsSitemaps(int maxRobotsSitemaps) {
            this.maxRobotsSitemaps = Math.max(1, maxRobotsSitemaps);
        }

        public boolean isRobotsFailOpen() {
            return robotsFailOpen;
        }

        public void setRobotsFailOpen(boolean robotsFailOpen) {
            this.robotsFailOpen = robotsFailOpen;
        }
    }

    public static class Prioritization {
        private int maxPrioritizedPages = 25;
        private int maxPromptLinks = 400;

        public int getMaxPrioritizedPages() {
            return Math.max(1, maxPrioritizedPages);
        }

        public void setMaxPrioritizedPages(int maxPrioritizedPages) {
            this.maxPrioritizedPages = Math.max(1, maxPrioritizedPages);
        }

        public int getMaxPromptLinks() {
            return Math.max(1, maxPromptLinks);
        }

        public void setMaxPromptLinks(int maxPromptLinks) {
            this.maxPromptLinks = Math.max(1, maxPromptLinks);
        }
    }

    public static class Extraction {
        private int concurrency = 10;
        private int perPageTimeoutSeconds = 15;
        private int globalTimeoutSeconds = 0;
        private int minSubstantialContentLength = 500;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getPerPageTimeoutSeconds() {
            return Math.max(1, perPageTimeoutSeconds);
        }

        public void setPerPageTimeoutSeconds(int perPageTimeoutSeconds) {
            this.perPageTimeoutSeconds = Math.max(1, perPageTimeoutSeconds);
        }

        public int getGlobalTimeoutSeconds() {
            return Math.max(0, globalTimeoutSeconds);
        }

        public void setGlobalTimeoutSeconds(int globalTimeoutSeconds) {
            this.globalTimeoutSeconds = Math.max(0, globalTimeoutSeconds);
        }

        public int getMinSubstantialContentLength() {
            return Math.max(1, minSubstantialContentLength);
        }

        public void setMinSubstantialContentLength(int minSubstantialContentLength) {
            this.minSubstantialContentLength = Math.max(1, minSubstantialContentLength);
        }
    }

    public static class Synthesis {
        private int maxCharsPerPage = 4000;
        private int promptReserveChars = 4000;

        public int getMaxCharsPerPage() {
            return Math.max(200, maxCharsPerPage);
        }

        public void setMaxCharsPerPage(int maxCharsPerPage) {
            this.maxCharsPerPage = maxCharsPerPage;
        }

        public int getPromptReserveChars() {
            return Math.max(0, promptReserveChars);
        }

        public void setPromptReserveChars(int promptReserveChars) {
            this.promptReserveChars = promptReserveChars;
        }
    }

    public static class Render {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:11235";
        private int timeoutSeconds = 30;

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

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class RateLimit {
        private double permitsPerSecond = 2.0;
        private int burst = 5;
        private int maxWaitSeconds = 30;

        public double getPermitsPerSecond() {
            return permitsPerSecond <= 0 ? 1.0 : permitsPerSecond;
        }

        public void setPermitsPerSecond(double permitsPerSecond) {
            this.permitsPerSecond = permitsPerSecond;
        }

        public int getBurst() {
            return Math.max(1, burst);
        }

        public void setBurst(int burst) {
            this.burst = Math.max(1, burst);
        }

        public int getMaxWaitSeconds() {
            return Math.max(0, maxWaitSeconds);
        }

        public void setMaxWaitSeconds(int maxWaitSeconds) {
            this.maxWaitSeconds = Math.max(0, maxWaitSeconds);
        }
    }

    public static class Providers {
        private Map<String, Definition> definitions = new LinkedHashMap<>();
        private Routes routes = new Routes();

        public Map<String, Definition> getDefinitions() {
            return definitions;
        }

        public void setDefinitions(Map<String, Definition> definitions) {
            this.definitions = definitions == null ? new LinkedHashMap<>() : definitions;
        }

        public Routes getRoutes() {
            return routes;
        }

        public void setRoutes(Routes routes) {
            this.routes = routes;
        }
    }

    public static class Definition {
        private String baseUrl;
        private String apiKey;
        private String model;
        private double temperature = 0.1;
        private int timeoutSeconds = 60;
        private int contextBudgetChars = 60_000;
        private double inputCostPerMillionTokens = 0.0;
        private double outputCostPerMillionTokens = 0.0;
        private int typicalLatencyMs = 5000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getContextBudgetChars() {
            return Math.max(1000, contextBudgetChars);
        }

        public void setContextBudgetChars(int contextBudgetChars) {
            this.contextBudgetChars = contextBudgetChars;
        }

        public double getInputCostPerMillionTokens() {
            return Math.max(0.0, inputCostPerMillionTokens);
        }

        public void setInputCostPerMillionTokens(double inputCostPerMillionTokens) {
            this.inputCostPerMillionTokens = inputCostPerMillionTokens;
        }

        public double getOutputCostPerMillionTokens() {
            return Math.max(0.0, outputCostPerMillionTokens);
        }

        public void setOutputCostPerMillionTokens(double outputCostPerMillionTokens) {
            this.outputCostPerMillionTokens = outputCostPerMillionTokens;
        }

        public int getTypicalLatencyMs() {
            return Math.max(0, typicalLatencyMs);
        }

        public void setTypicalLatencyMs(int typicalLatencyMs) {
            this.typicalLatencyMs = typicalLatencyMs;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && model != null && !model.isBlank();
        }
    }

    public static class Routes {
        private Route pageSelection = new Route();
        private Route synthesis = new Route();
        private Route classification = new Route();
        private Route embedding = new Route();

        public Route getPageSelection() {
            return pageSelection;
        }

        public void setPageSelection(Route pageSelection) {
            this.pageSelection = pageSelection;
        }

        public Route getSynthesis() {
            return synthesis;
        }

        public void setSynthesis(Route synthesis) {
            this.synthesis = synthesis;
        }

        public Route getClassification() {
            return classification;
        }

        public void setClassification(Route classification) {
            this.classification = classification;
        }

        public Route getEmbedding() {
            return embedding;
        }

        public void setEmbedding(Route embedding) {
            this.embedding = embedding;
        }
    }

    public static class Route {
        private String primary = "default";
        private String secondary;

        public String getPrimary() {
            return primary;
        }

        public void setPrimary(String primary) {
            this.primary = primary;
        }

        public String getSecondary() {
            return secondary;
        }

        public void setSecondary(String secondary) {
            this.secondary = secondary;
        }

        public ProviderRoute toRoute() {
            return new ProviderRoute(primary, secondary);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String companyName = "";
        private String url = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCompanyName() {
            return companyName;
        }

        public void setCompanyName(String companyName) {
            this.companyName = companyName;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

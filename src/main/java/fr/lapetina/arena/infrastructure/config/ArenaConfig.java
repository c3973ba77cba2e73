package fr.lapetina.arena.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the arena.
 * Designed to be populated from YAML.
 */
public class ArenaConfig {

    private ServerConfig server = new ServerConfig();
    private ApiConfig api = new ApiConfig();
    private RetryConfig retry = new RetryConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private ValidationConfig validation = new ValidationConfig();
    private SessionsConfig sessions = new SessionsConfig();
    private VoteStoreConfig voteStore = new VoteStoreConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<ModelConfig> models = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public SessionsConfig getSessions() { return sessions; }
    public void setSessions(SessionsConfig sessions) { this.sessions = sessions; }

    public VoteStoreConfig getVoteStore() { return voteStore; }
    public void setVoteStore(VoteStoreConfig voteStore) { this.voteStore = voteStore; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Upstream chat-completions API.
     */
    public static class ApiConfig {
        private String baseUrl = "https://genai.rcac.purdue.edu/api/chat/completions";
        private String apiKey = "";
        private String apiKeyEnv = "API_KEY";
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 60000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Retry configuration for transient upstream failures.
     */
    public static class RetryConfig {
        private int maxRetries = 2;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 8000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Per-model cool-down after a throttle signal.
     */
    public static class RateLimitConfig {
        private long cooldownMs = 60000;

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    /**
     * Prompt validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 2000;

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
    }

    /**
     * Session registry configuration.
     */
    public static class SessionsConfig {
        private long idleTimeoutMs = 1800000;

        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
    }

    /**
     * Vote persistence configuration.
     */
    public static class VoteStoreConfig {
        private String type = "memory";
        private String path = "data/arena-votes.db";
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "arena";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * One model of the pool.
     */
    public static class ModelConfig {
        private String id;
        private String displayName;
        private String category;
        private int contextLength;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public int getContextLength() { return contextLength; }
        public void setContextLength(int contextLength) { this.contextLength = contextLength; }
    }
}

package org.iceforge.strata.semantic.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "strata")
public class StrataProperties {

    /**
     * Semantic layer YAML on the classpath, used when a compile request does not carry its own layer.
     */
    @NotBlank
    private String modelResource = "semantic-layer.yml";

    @Valid
    private final Warehouse warehouse = new Warehouse();

    @Valid
    private final Generator generator = new Generator();

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final RateLimiter rateLimiter = new RateLimiter();

    public String getModelResource() {
        return modelResource;
    }

    public void setModelResource(String modelResource) {
        this.modelResource = modelResource;
    }

    public Warehouse getWarehouse() {
        return warehouse;
    }

    public Generator getGenerator() {
        return generator;
    }

    public Cache getCache() {
        return cache;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public static class Warehouse {

        /**
         * Base URL of the SQL execution service, e.g. http://localhost:8080
         */
        @NotBlank
        private String baseUrl = "http://localhost:8080";

        /**
         * Path used to submit compiled SQL. The service answers with {"queryId":"...","totalRows":n}.
         */
        @NotBlank
        private String submitPath = "/api/v1/queries";

        private String jdbcUrl;
        private String username;
        private String password;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSubmitPath() {
            return submitPath;
        }

        public void setSubmitPath(String submitPath) {
            this.submitPath = submitPath;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Generator {

        /**
         * Base URL of an OpenAI-compatible chat completions API.
         */
        @NotBlank
        private String baseUrl = "https://api.openai.com";

        @NotBlank
        private String completionsPath = "/v1/chat/completions";

        private String apiKey;

        @NotBlank
        private String defaultModel = "gpt-4o";

        /**
         * Models whose cached answers are accepted for a question, checked in order before the requested model.
         */
        @NotNull
        private List<String> cacheModels = new ArrayList<>(List.of("gpt-4o", "llama3-70b-8192", "o1-mini"));

        /**
         * Plain-text description of the warehouse tables included in the prompt.
         */
        @NotBlank
        private String schemaResource = "prompt/database-schema.txt";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public List<String> getCacheModels() {
            return cacheModels;
        }

        public void setCacheModels(List<String> cacheModels) {
            this.cacheModels = cacheModels;
        }

        public String getSchemaResource() {
            return schemaResource;
        }

        public void setSchemaResource(String schemaResource) {
            this.schemaResource = schemaResource;
        }
    }

    public static class Cache {

        /**
         * JSON file holding cached generator answers. Rewritten atomically on every update.
         */
        @NotBlank
        private String path = "llm_cache.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class RateLimiter {

        @NotNull
        private Duration minDelay = Duration.ofMillis(1);

        @NotNull
        private Duration maxDelay = Duration.ofMillis(50);

        /**
         * Timeout applied to every attempt.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(80);

        /**
         * Minimum spacing between two slow-downs.
         */
        @NotNull
        private Duration slowdownInterval = Duration.ofMillis(10);

        @Positive
        private int maxAttempts = 5;

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getSlowdownInterval() {
            return slowdownInterval;
        }

        public void setSlowdownInterval(Duration slowdownInterval) {
            this.slowdownInterval = slowdownInterval;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}

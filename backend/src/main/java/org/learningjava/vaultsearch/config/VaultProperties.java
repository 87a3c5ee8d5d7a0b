package org.learningjava.vaultsearch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    @NotBlank
    private String path = "/var/notes";
    private String name = "notes";
    @NotEmpty
    private List<String> include = new ArrayList<>(List.of("**/*.md"));
    private List<String> exclude = new ArrayList<>(List.of("**/templates/**", "**/.obsidian/**"));

    @Valid
    private final Chunking chunking = new Chunking();
    @Valid
    private final Embedding embedding = new Embedding();
    @Valid
    private final Search search = new Search();
    @Valid
    private final Store store = new Store();
    private final Index index = new Index();

    public String getPath() { return path; }
    public void setPath(String v) { this.path = v; }
    public String getName() { return name; }
    public void setName(String v) { this.name = v; }
    public List<String> getInclude() { return include; }
    public void setInclude(List<String> v) { this.include = v; }
    public List<String> getExclude() { return exclude; }
    public void setExclude(List<String> v) { this.exclude = v; }
    public Chunking getChunking() { return chunking; }
    public Embedding getEmbedding() { return embedding; }
    public Search getSearch() { return search; }
    public Store getStore() { return store; }
    public Index getIndex() { return index; }

    public static class Chunking {
        @Min(1)
        private int targetTokens = 500;
        @Min(0)
        private int overlapTokens = 50;

        public int getTargetTokens() { return targetTokens; }
        public void setTargetTokens(int v) { this.targetTokens = v; }
        public int getOverlapTokens() { return overlapTokens; }
        public void setOverlapTokens(int v) { this.overlapTokens = v; }
    }

    public static class Embedding {
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";
        // checked on first use, not at startup
        private String apiKey = "";
        private String model = "text-embedding-3-small";
        @Min(1)
        private int batchSize = 100;
        @Min(1)
        private int maxBatchSize = 2048;
        private Duration timeout = Duration.ofSeconds(30);
        @Valid
        private final Retry retry = new Retry();

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String v) { this.baseUrl = v; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String v) { this.apiKey = v; }
        public String getModel() { return model; }
        public void setModel(String v) { this.model = v; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int v) { this.batchSize = v; }
        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int v) { this.maxBatchSize = v; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration v) { this.timeout = v; }
        public Retry getRetry() { return retry; }
    }

    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int v) { this.maxAttempts = v; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration v) { this.initialBackoff = v; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration v) { this.maxBackoff = v; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double v) { this.multiplier = v; }
    }

    public static class Search {
        private boolean enabled = true;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minScore = 0.3;
        @Min(1)
        private int topK = 5;
        @Min(0)
        private int maxCitations = 5;
        private boolean dateFilter = false;
        // blank means the JVM default zone
        private String timeZone = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public double getMinScore() { return minScore; }
        public void setMinScore(double v) { this.minScore = v; }
        public int getTopK() { return topK; }
        public void setTopK(int v) { this.topK = v; }
        public int getMaxCitations() { return maxCitations; }
        public void setMaxCitations(int v) { this.maxCitations = v; }
        public boolean isDateFilter() { return dateFilter; }
        public void setDateFilter(boolean v) { this.dateFilter = v; }
        public String getTimeZone() { return timeZone; }
        public void setTimeZone(String v) { this.timeZone = v; }
    }

    public static class Store {
        public enum Type { MEMORY, POSTGRES }

        private Type type = Type.MEMORY;
        private String jdbcUrl = "";
        private String username = "";
        private String password = "";
        @Min(1)
        private int poolSize = 4;
        @Min(1)
        private int dimensions = 1536;

        public Type getType() { return type; }
        public void setType(Type v) { this.type = v; }
        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String v) { this.jdbcUrl = v; }
        public String getUsername() { return username; }
        public void setUsername(String v) { this.username = v; }
        public String getPassword() { return password; }
        public void setPassword(String v) { this.password = v; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int v) { this.poolSize = v; }
        public int getDimensions() { return dimensions; }
        public void setDimensions(int v) { this.dimensions = v; }
    }

    public static class Index {
        private boolean onStartup = false;

        public boolean isOnStartup() { return onStartup; }
        public void setOnStartup(boolean v) { this.onStartup = v; }
    }
}

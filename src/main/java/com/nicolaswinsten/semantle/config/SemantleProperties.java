package com.nicolaswinsten.semantle.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * All {@code semantle.*} settings.
 *
 * <p>Defaults are tuned for a single small instance; see {@code application.properties}.
 */
@Validated
@ConfigurationProperties(prefix = "semantle")
public class SemantleProperties {

    @Valid
    private Vocabulary vocabulary = new Vocabulary();
    @Valid
    private Game game = new Game();
    @Valid
    private Embedding embedding = new Embedding();
    @Valid
    private Stats stats = new Stats();
    @Valid
    private Web web = new Web();

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public void setVocabulary(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public Game getGame() {
        return game;
    }

    public void setGame(Game game) {
        this.game = game;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats;
    }

    public Web getWeb() {
        return web;
    }

    public void setWeb(Web web) {
        this.web = web;
    }

    public static class Vocabulary {
        /** Spring resource location of the vocabulary JSON. */
        @NotBlank
        private String location = "classpath:vocabulary.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Game {
        /** Reject a word already guessed in the same session instead of re-scoring it. */
        private boolean rejectDuplicates = false;
        /** Sessions idle for longer than this are evicted. */
        @NotNull
        private Duration sessionTtl = Duration.ofHours(6);
        @NotNull
        private Duration evictionInterval = Duration.ofMinutes(5);
        /** Rankings shared across sessions with the same target; 0 disables sharing. */
        @Min(0)
        private int rankingCacheSize = 32;

        public boolean isRejectDuplicates() {
            return rejectDuplicates;
        }

        public void setRejectDuplicates(boolean rejectDuplicates) {
            this.rejectDuplicates = rejectDuplicates;
        }

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }

        public Duration getEvictionInterval() {
            return evictionInterval;
        }

        public void setEvictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
        }

        public int getRankingCacheSize() {
            return rankingCacheSize;
        }

        public void setRankingCacheSize(int rankingCacheSize) {
            this.rankingCacheSize = rankingCacheSize;
        }
    }

    public static class Embedding {
        /** {@code none} or {@code openai}. */
        @NotBlank
        private String provider = "none";
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        @Valid
        private OpenAi openai = new OpenAi();
        @Valid
        private Pool pool = new Pool();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public OpenAi getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAi openai) {
            this.openai = openai;
        }

        public Pool getPool() {
            return pool;
        }

        public void setPool(Pool pool) {
            this.pool = pool;
        }
    }

    public static class OpenAi {
        private String apiKey;
        @NotBlank
        private String baseUrl = "https://api.openai.com";
        @NotBlank
        private String model = "text-embedding-3-large";

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

    /** Bounded executor for provider calls. */
    public static class Pool {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 50;
        private String threadNamePrefix = "embedding-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    public static class Stats {
        /** Player ledgers not read or written for longer than this are dropped. */
        @NotNull
        private Duration ledgerTtl = Duration.ofDays(30);

        public Duration getLedgerTtl() {
            return ledgerTtl;
        }

        public void setLedgerTtl(Duration ledgerTtl) {
            this.ledgerTtl = ledgerTtl;
        }
    }

    public static class Web {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:5173"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}

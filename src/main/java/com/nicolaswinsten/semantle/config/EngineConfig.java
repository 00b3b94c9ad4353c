package com.nicolaswinsten.semantle.config;

import java.time.Clock;
import java.util.Locale;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.nicolaswinsten.semantle.embedding.EmbeddingProvider;
import com.nicolaswinsten.semantle.embedding.EmbeddingService;
import com.nicolaswinsten.semantle.embedding.OpenAiEmbeddingProvider;
import com.nicolaswinsten.semantle.embedding.UnavailableEmbeddingProvider;
import com.nicolaswinsten.semantle.game.GameService;
import com.nicolaswinsten.semantle.game.GuessEvaluator;
import com.nicolaswinsten.semantle.game.RankingCache;
import com.nicolaswinsten.semantle.game.SessionEvictionTask;
import com.nicolaswinsten.semantle.game.SessionStore;
import com.nicolaswinsten.semantle.game.SimilarityRanker;
import com.nicolaswinsten.semantle.game.TargetSelector;
import com.nicolaswinsten.semantle.stats.LedgerEvictionTask;
import com.nicolaswinsten.semantle.stats.StatsService;
import com.nicolaswinsten.semantle.vocabulary.Vocabulary;
import com.nicolaswinsten.semantle.vocabulary.VocabularyLoader;

/**
 * Wires the game engine. The vocabulary is loaded eagerly, so a malformed vocabulary stops
 * the application from starting.
 */
@Configuration
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    private final SemantleProperties properties;

    public EngineConfig(SemantleProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(RestTemplateBuilder restTemplateBuilder) {
        SemantleProperties.Embedding embedding = properties.getEmbedding();
        String provider = embedding.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "openai": {
                SemantleProperties.OpenAi openai = embedding.getOpenai();
                LOGGER.info("Embedding provider: openai, model={}", openai.getModel());
                return new OpenAiEmbeddingProvider(
                    restTemplateBuilder
                        .setConnectTimeout(embedding.getTimeout())
                        .setReadTimeout(embedding.getTimeout())
                        .build(),
                    openai.getApiKey(), openai.getBaseUrl(), openai.getModel());
            }
            case "none":
                return new UnavailableEmbeddingProvider();
            default:
                throw new IllegalStateException("Unknown semantle.embedding.provider: " + embedding.getProvider());
        }
    }

    @Bean
    public Vocabulary vocabulary(ResourceLoader resourceLoader, ObjectMapper objectMapper, EmbeddingProvider embeddingProvider) {
        VocabularyLoader loader = new VocabularyLoader(objectMapper, embeddingProvider);
        return loader.load(resourceLoader.getResource(properties.getVocabulary().getLocation()));
    }

    @Bean
    public EmbeddingService embeddingService(Vocabulary vocabulary, EmbeddingProvider embeddingProvider,
                                             @Qualifier("embeddingExecutor") ThreadPoolTaskExecutor embeddingExecutor) {
        return new EmbeddingService(vocabulary, embeddingProvider, embeddingExecutor, properties.getEmbedding().getTimeout());
    }

    @Bean
    public SimilarityRanker similarityRanker(Vocabulary vocabulary) {
        return new SimilarityRanker(vocabulary);
    }

    @Bean
    public RankingCache rankingCache(SimilarityRanker similarityRanker) {
        return new RankingCache(similarityRanker, properties.getGame().getRankingCacheSize());
    }

    @Bean
    public TargetSelector targetSelector(Vocabulary vocabulary, Clock clock) {
        return new TargetSelector(vocabulary, clock);
    }

    @Bean
    public SessionStore sessionStore(Clock clock) {
        return new SessionStore(clock);
    }

    @Bean
    public SessionEvictionTask sessionEvictionTask(SessionStore sessionStore) {
        return new SessionEvictionTask(sessionStore, properties.getGame().getSessionTtl());
    }

    @Bean
    public GuessEvaluator guessEvaluator(Vocabulary vocabulary, SessionStore sessionStore, RankingCache rankingCache, Clock clock) {
        return new GuessEvaluator(vocabulary, sessionStore, rankingCache, clock, properties.getGame().isRejectDuplicates());
    }

    @Bean
    public GameService gameService(Vocabulary vocabulary, TargetSelector targetSelector,
                                   EmbeddingService embeddingService, SessionStore sessionStore) {
        return new GameService(vocabulary, targetSelector, embeddingService, sessionStore);
    }

    @Bean
    public StatsService statsService(SessionStore sessionStore, Clock clock) {
        return new StatsService(sessionStore, clock);
    }

    @Bean
    public LedgerEvictionTask ledgerEvictionTask(StatsService statsService) {
        return new LedgerEvictionTask(statsService, properties.getStats().getLedgerTtl());
    }
}

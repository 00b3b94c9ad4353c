package com.nicolaswinsten.semantle.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nicolaswinsten.semantle.embedding.EmbeddingService;
import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;
import com.nicolaswinsten.semantle.exception.SessionNotFoundException;
import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * Entry point for everything except guessing: starting games, reading sessions and
 * checking words.
 */
public class GameService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameService.class);

    private final Vocabulary vocabulary;
    private final TargetSelector targetSelector;
    private final EmbeddingService embeddingService;
    private final SessionStore sessionStore;

    public GameService(Vocabulary vocabulary, TargetSelector targetSelector,
                       EmbeddingService embeddingService, SessionStore sessionStore) {
        this.vocabulary = vocabulary;
        this.targetSelector = targetSelector;
        this.embeddingService = embeddingService;
        this.sessionStore = sessionStore;
    }

    /**
     * Picks a target, resolves its vector, then stores the session. If the vector cannot be
     * resolved nothing is stored.
     *
     * @throws EmbeddingProviderException if the target vector is not precomputed and the provider fails
     */
    public GameSnapshot newGame(boolean daily) {
        String target = daily ? targetSelector.dailyTarget() : targetSelector.randomTarget();
        float[] targetVector = embeddingService.resolve(target);
        GameSnapshot session = sessionStore.create(target, targetVector, daily);
        LOGGER.info("Session created: sessionId={}, daily={}", session.sessionId(), daily);
        return session;
    }

    /**
     * @throws SessionNotFoundException if the session is unknown or expired
     */
    public GameSnapshot session(String sessionId) {
        return sessionStore.get(sessionId);
    }

    public boolean isValidWord(String word) {
        String normalized = Vocabulary.normalize(word);
        return !normalized.isEmpty() && vocabulary.contains(normalized);
    }

    public int vocabularySize() {
        return vocabulary.size();
    }
}

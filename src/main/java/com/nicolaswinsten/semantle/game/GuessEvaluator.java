package com.nicolaswinsten.semantle.game;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nicolaswinsten.semantle.exception.DuplicateGuessException;
import com.nicolaswinsten.semantle.exception.InvalidWordException;
import com.nicolaswinsten.semantle.exception.SessionAlreadyCompletedException;
import com.nicolaswinsten.semantle.exception.SessionNotFoundException;
import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * Scores one guess against one session as a single locked transaction.
 *
 * <h3>Session states</h3>
 * Active until the target is guessed, then Completed. A completed session accepts no more
 * guesses. Every check runs before the attempt is appended, so a rejected guess leaves the
 * session exactly as it was.
 */
public class GuessEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GuessEvaluator.class);

    private final Vocabulary vocabulary;
    private final SessionStore sessionStore;
    private final RankingCache rankingCache;
    private final Clock clock;
    private final boolean rejectDuplicates;

    public GuessEvaluator(Vocabulary vocabulary, SessionStore sessionStore, RankingCache rankingCache,
                          Clock clock, boolean rejectDuplicates) {
        this.vocabulary = vocabulary;
        this.sessionStore = sessionStore;
        this.rankingCache = rankingCache;
        this.clock = clock;
        this.rejectDuplicates = rejectDuplicates;
    }

    /**
     * @throws SessionNotFoundException         if the session is unknown or expired
     * @throws SessionAlreadyCompletedException if the target was already found
     * @throws InvalidWordException             if the word is blank or not in the vocabulary
     * @throws DuplicateGuessException          if duplicates are rejected and the word was guessed before
     */
    public AttemptResult submitGuess(String sessionId, String word) {
        String normalized = Vocabulary.normalize(word);
        AttemptResult result = sessionStore.update(sessionId, session -> {
            if (session.isCompleted()) {
                throw new SessionAlreadyCompletedException(sessionId);
            }
            if (normalized.isEmpty() || !vocabulary.contains(normalized)) {
                throw new InvalidWordException(normalized);
            }
            if (rejectDuplicates && session.hasGuessed(normalized)) {
                throw new DuplicateGuessException(normalized);
            }
            Ranking ranking = session.ranking();
            if (ranking == null) {
                ranking = rankingCache.rankingFor(session.targetWord(), session.targetVector());
                session.cacheRanking(ranking);
            }
            double similarity = ranking.similarityOf(normalized);
            int rank = ranking.rankOf(normalized);
            boolean correct = normalized.equals(session.targetWord());

            session.record(new Attempt(normalized, similarity, rank, correct, clock.instant()));
            return new AttemptResult(sessionId, normalized, similarity, rank, correct, session.attemptCount());
        });
        if (result.correct()) {
            LOGGER.info("Session completed: sessionId={}, attempts={}", sessionId, result.attempts());
        } else {
            LOGGER.debug("Guess scored: sessionId={}, rank={}", sessionId, result.rank());
        }
        return result;
    }
}

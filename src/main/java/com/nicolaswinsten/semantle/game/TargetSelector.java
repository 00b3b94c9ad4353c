package com.nicolaswinsten.semantle.game;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.util.DigestUtils;

import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

/**
 * Picks target words: uniformly at random for regular games, or as a pure function of the UTC
 * calendar date for the daily challenge.
 */
public class TargetSelector {

    private final Vocabulary vocabulary;
    private final Clock clock;

    public TargetSelector(Vocabulary vocabulary, Clock clock) {
        this.vocabulary = vocabulary;
        this.clock = clock;
    }

    /** Uniform pick over the vocabulary. */
    public String randomTarget() {
        List<String> words = vocabulary.allWords();
        return words.get(ThreadLocalRandom.current().nextInt(words.size()));
    }

    /** Today's daily word, by the injected clock in UTC. */
    public String dailyTarget() {
        return dailyTarget(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    /**
     * MD5 of the ISO date string, read as an unsigned integer, modulo the vocabulary size,
     * indexed into vocabulary order. Same date and vocabulary always give the same word.
     */
    public String dailyTarget(LocalDate dateUtc) {
        byte[] digest = DigestUtils.md5Digest(dateUtc.toString().getBytes(StandardCharsets.UTF_8));
        int index = new BigInteger(1, digest).mod(BigInteger.valueOf(vocabulary.size())).intValue();
        return vocabulary.wordAt(index);
    }
}

package com.nicolaswinsten.semantle.game;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.nicolaswinsten.semantle.vocabulary.TestVocabularies;
import com.nicolaswinsten.semantle.vocabulary.Vocabulary;

import static org.assertj.core.api.Assertions.assertThat;

class TargetSelectorTest {

    private final Vocabulary vocabulary = TestVocabularies.sized(500);

    @Test
    void randomTargetIsAlwaysAVocabularyWord() {
        TargetSelector selector = new TargetSelector(vocabulary, Clock.systemUTC());
        for (int i = 0; i < 100; i++) {
            assertThat(vocabulary.contains(selector.randomTarget())).isTrue();
        }
    }

    @Test
    void randomTargetVaries() {
        TargetSelector selector = new TargetSelector(vocabulary, Clock.systemUTC());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            seen.add(selector.randomTarget());
        }
        assertThat(seen).hasSizeGreaterThan(1);
    }

    @Test
    void dailyTargetIsStableForADate() {
        LocalDate date = LocalDate.of(2026, 10, 19);
        String first = new TargetSelector(vocabulary, Clock.systemUTC()).dailyTarget(date);
        // a fresh selector stands in for a restarted process
        String second = new TargetSelector(TestVocabularies.sized(500), Clock.systemUTC()).dailyTarget(date);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void dailyTargetUsesUtcDateOfTheClock() {
        Instant instant = Instant.parse("2026-10-19T23:30:00Z");
        TargetSelector utc = new TargetSelector(vocabulary, Clock.fixed(instant, ZoneOffset.UTC));
        // same instant seen from a zone where it is already the 20th
        TargetSelector tokyo = new TargetSelector(vocabulary, Clock.fixed(instant, ZoneId.of("Asia/Tokyo")));

        assertThat(utc.dailyTarget()).isEqualTo(utc.dailyTarget(LocalDate.of(2026, 10, 19)));
        assertThat(tokyo.dailyTarget()).isEqualTo(utc.dailyTarget());
    }

    @Test
    void dailyTargetChangesAcrossDays() {
        TargetSelector selector = new TargetSelector(vocabulary, Clock.systemUTC());
        Set<String> targets = new HashSet<>();
        LocalDate start = LocalDate.of(2026, 1, 1);
        for (int d = 0; d < 30; d++) {
            targets.add(selector.dailyTarget(start.plusDays(d)));
        }
        assertThat(targets).hasSizeGreaterThan(1);
    }
}

package com.nicolaswinsten.semantle.vocabulary;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.nicolaswinsten.semantle.exception.VocabularyLoadException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VocabularyTest {

    @Test
    void containsIsCaseInsensitiveAndTrims() {
        Vocabulary vocabulary = TestVocabularies.catDogCar();
        assertThat(vocabulary.contains("cat")).isTrue();
        assertThat(vocabulary.contains("  CAT ")).isTrue();
        assertThat(vocabulary.contains("cow")).isFalse();
        assertThat(vocabulary.contains(null)).isFalse();
    }

    @Test
    void allWordsKeepsSuppliedOrder() {
        assertThat(TestVocabularies.catDogCar().allWords()).containsExactly("cat", "dog", "car");
    }

    @Test
    void wordsAreNormalizedOnLoad() {
        Vocabulary vocabulary = Vocabulary.of(List.of(new VocabularyEntry(" Apple ", new float[] {1f})));
        assertThat(vocabulary.allWords()).containsExactly("apple");
        assertThat(vocabulary.indexOf("APPLE")).isZero();
    }

    @Test
    void vectorOfReturnsStoredVectorOrEmpty() {
        Vocabulary vocabulary = TestVocabularies.catDogCar();
        assertThat(vocabulary.vectorOf("Dog")).hasValueSatisfying(v -> assertThat(v).containsExactly(0.9f, 0.1f));
        assertThat(vocabulary.vectorOf("cow")).isEmpty();
        assertThat(vocabulary.dimensions()).isEqualTo(2);
        assertThat(vocabulary.size()).isEqualTo(3);
    }

    @Test
    void duplicateAfterNormalizationIsLoadError() {
        assertThatThrownBy(() -> Vocabulary.of(List.of(
            new VocabularyEntry("cat", new float[] {1f, 0f}),
            new VocabularyEntry("CAT ", new float[] {0f, 1f}))))
            .isInstanceOf(VocabularyLoadException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void mismatchedDimensionsIsLoadError() {
        assertThatThrownBy(() -> Vocabulary.of(List.of(
            new VocabularyEntry("cat", new float[] {1f, 0f}),
            new VocabularyEntry("dog", new float[] {1f, 0f, 0f}))))
            .isInstanceOf(VocabularyLoadException.class)
            .hasMessageContaining("dimensions");
    }

    @Test
    void emptyVocabularyIsLoadError() {
        assertThatThrownBy(() -> Vocabulary.of(List.of()))
            .isInstanceOf(VocabularyLoadException.class);
    }

    @Test
    void loadErrorCarriesStableCode() {
        assertThat(new VocabularyLoadException("x").getErrorCode()).isEqualTo("LoadError");
    }
}

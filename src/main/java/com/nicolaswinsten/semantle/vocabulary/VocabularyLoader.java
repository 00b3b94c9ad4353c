package com.nicolaswinsten.semantle.vocabulary;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.nicolaswinsten.semantle.embedding.EmbeddingProvider;
import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;
import com.nicolaswinsten.semantle.exception.VocabularyLoadException;

/**
 * Reads a {@link Vocabulary} from JSON.
 *
 * <h3>Accepted shapes</h3>
 * <ul>
 *   <li>{@code {"embeddings": {"cat": [0.1, ...], ...}}}: precomputed vectors.</li>
 *   <li>{@code {"words": ["cat", ...]}}: a plain word list; vectors are fetched from the
 *       {@link EmbeddingProvider} in one batch while loading.</li>
 * </ul>
 * Blank words are skipped. Document order becomes vocabulary order.
 */
public class VocabularyLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(VocabularyLoader.class);

    private final ObjectMapper objectMapper;
    private final EmbeddingProvider embeddingProvider;

    public VocabularyLoader(ObjectMapper objectMapper, EmbeddingProvider embeddingProvider) {
        this.objectMapper = objectMapper;
        this.embeddingProvider = embeddingProvider;
    }

    /**
     * @throws VocabularyLoadException if the resource is missing, unreadable, has duplicate keys,
     *                                 or fails {@link Vocabulary#of} validation
     */
    public Vocabulary load(Resource source) {
        if (source == null || !source.exists()) {
            throw new VocabularyLoadException("Vocabulary source not found: " + source);
        }
        JsonNode root;
        try (InputStream in = source.getInputStream()) {
            root = objectMapper.reader()
                .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .readTree(in);
        } catch (IOException e) {
            throw new VocabularyLoadException("Could not read vocabulary from " + source.getDescription(), e);
        }
        Vocabulary vocabulary = parse(root);
        LOGGER.info("Vocabulary loaded: source={}, words={}, dimensions={}",
            source.getDescription(), vocabulary.size(), vocabulary.dimensions());
        return vocabulary;
    }

    Vocabulary parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new VocabularyLoadException("Vocabulary JSON must be an object");
        }
        JsonNode embeddings = root.get("embeddings");
        if (embeddings != null) {
            return Vocabulary.of(readEmbeddings(embeddings));
        }
        JsonNode words = root.get("words");
        if (words != null) {
            return Vocabulary.of(embedWords(readWords(words)));
        }
        throw new VocabularyLoadException("Vocabulary JSON needs an 'embeddings' object or a 'words' array");
    }

    private static List<VocabularyEntry> readEmbeddings(JsonNode embeddings) {
        if (!embeddings.isObject()) {
            throw new VocabularyLoadException("'embeddings' must map words to number arrays");
        }
        List<VocabularyEntry> entries = new ArrayList<>(embeddings.size());
        Iterator<Map.Entry<String, JsonNode>> fields = embeddings.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String word = Vocabulary.normalize(field.getKey());
            if (word.isEmpty()) {
                continue;
            }
            entries.add(new VocabularyEntry(word, readVector(word, field.getValue())));
        }
        return entries;
    }

    private static float[] readVector(String word, JsonNode node) {
        if (!node.isArray()) {
            throw new VocabularyLoadException("Embedding for '" + word + "' is not an array");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber()) {
                throw new VocabularyLoadException("Embedding for '" + word + "' has a non-numeric value at " + i);
            }
            vector[i] = v.floatValue();
        }
        return vector;
    }

    private static List<String> readWords(JsonNode words) {
        if (!words.isArray()) {
            throw new VocabularyLoadException("'words' must be an array of strings");
        }
        List<String> out = new ArrayList<>(words.size());
        for (JsonNode node : words) {
            String word = Vocabulary.normalize(node.asText());
            if (!word.isEmpty()) {
                out.add(word);
            }
        }
        return out;
    }

    private List<VocabularyEntry> embedWords(List<String> words) {
        if (words.isEmpty()) {
            throw new VocabularyLoadException("Vocabulary is empty");
        }
        LOGGER.info("Fetching embeddings for {} words from provider={}", words.size(), embeddingProvider.name());
        List<float[]> vectors;
        try {
            vectors = embeddingProvider.embed(words);
        } catch (EmbeddingProviderException e) {
            throw new VocabularyLoadException("Could not embed word list: " + e.getMessage(), e);
        }
        if (vectors.size() != words.size()) {
            throw new VocabularyLoadException("Provider returned " + vectors.size() + " vectors for " + words.size() + " words");
        }
        List<VocabularyEntry> entries = new ArrayList<>(words.size());
        for (int i = 0; i < words.size(); i++) {
            entries.add(new VocabularyEntry(words.get(i), vectors.get(i)));
        }
        return entries;
    }
}

package com.nicolaswinsten.semantle.embedding;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.nicolaswinsten.semantle.exception.EmbeddingProviderException;

/**
 * Calls the OpenAI embeddings endpoint ({@code POST /v1/embeddings}).
 *
 * <p>The whole batch goes out in one request; the response items are re-ordered by their
 * {@code index} field so the output lines up with the input.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAiEmbeddingProvider(RestTemplate restTemplate, String apiKey, String baseUrl, String model) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
    }

    @Override
    public List<float[]> embed(List<String> words) {
        if (words.isEmpty()) {
            return List.of();
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingProviderException(name(), "OpenAI API key is not set (semantle.embedding.openai.api-key)");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbeddingRequest> request = new HttpEntity<>(new EmbeddingRequest(model, words), headers);

        ResponseEntity<EmbeddingResponse> resp;
        try {
            resp = restTemplate.exchange(baseUrl + "/v1/embeddings", HttpMethod.POST, request, EmbeddingResponse.class);
        } catch (RestClientException e) {
            throw new EmbeddingProviderException(name(), "OpenAI embeddings request failed: " + e.getMessage(), e);
        }
        EmbeddingResponse body = resp.getBody();
        if (!resp.getStatusCode().is2xxSuccessful() || body == null || body.data() == null) {
            throw new EmbeddingProviderException(name(), "OpenAI embeddings returned status " + resp.getStatusCode().value());
        }
        if (body.data().size() != words.size()) {
            throw new EmbeddingProviderException(name(), "OpenAI returned " + body.data().size()
                + " embeddings for " + words.size() + " inputs");
        }

        float[][] ordered = new float[words.size()][];
        for (EmbeddingItem item : body.data()) {
            if (item.index() < 0 || item.index() >= ordered.length || item.embedding() == null) {
                throw new EmbeddingProviderException(name(), "OpenAI returned a malformed embedding item");
            }
            ordered[item.index()] = toFloats(item.embedding());
        }
        List<float[]> result = new ArrayList<>(ordered.length);
        for (float[] vector : ordered) {
            if (vector == null) {
                throw new EmbeddingProviderException(name(), "OpenAI response is missing an embedding");
            }
            result.add(vector);
        }
        LOGGER.debug("Embedded {} words with model={}", words.size(), model);
        return result;
    }

    @Override
    public String name() {
        return "openai";
    }

    private static float[] toFloats(List<Double> values) {
        float[] out = new float[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).floatValue();
        }
        return out;
    }

    record EmbeddingRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingItem> data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingItem(int index, List<Double> embedding) {}
}

package org.learningjava.vaultsearch.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.learningjava.vaultsearch.application.port.EmbeddingConfigurationException;
import org.learningjava.vaultsearch.application.port.EmbeddingException;
import org.learningjava.vaultsearch.application.port.EmbeddingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Embeddings through an OpenAI-compatible {@code POST /embeddings} endpoint.
 * <p>
 * Inputs are sent in slices of at most {@link #maxBatchSize()}. Each response is put back in input order using
 * the {@code index} field of every item; positional order of the response is never trusted. Rate limits (429),
 * server errors (5xx) and network failures are retried with capped exponential backoff; everything else fails
 * the slice at once.
 */
public class OpenAiEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int maxBatchSize;
    private final RetryPolicy retry;

    public OpenAiEmbeddingAdapter(String baseUrl, String apiKey, String model, int maxBatchSize,
                                  RetryPolicy retry, OkHttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxBatchSize = maxBatchSize;
        this.retry = retry;
        this.http = http;
    }

    public OpenAiEmbeddingAdapter(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, 2048, RetryPolicy.DEFAULT, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .callTimeout(Duration.ofSeconds(60))
                .build());
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        checkConfigured();

        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += maxBatchSize) {
            List<String> slice = texts.subList(from, Math.min(from + maxBatchSize, texts.size()));
            out.addAll(Arrays.asList(embedWithRetry(slice)));
        }
        return out;
    }

    private void checkConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingConfigurationException("Embedding API key is not configured (vault.embedding.api-key)");
        }
        if (model == null || model.isBlank()) {
            throw new EmbeddingConfigurationException("Embedding model is not configured (vault.embedding.model)");
        }
    }

    private float[][] embedWithRetry(List<String> slice) {
        for (int attempt = 0; ; attempt++) {
            try {
                return callOnce(slice);
            } catch (TransientFailure e) {
                if (attempt + 1 >= retry.maxAttempts()) {
                    log.error("Embedding failed after {} attempts for {} inputs: {}",
                            attempt + 1, slice.size(), e.getMessage());
                    throw new EmbeddingException("Embedding failed after " + (attempt + 1) + " attempts: "
                            + e.getMessage(), e);
                }
                Duration delay = e.retryAfter != null
                        ? min(e.retryAfter, retry.maxBackoff())
                        : retry.delayFor(e.rateLimited ? attempt + 1 : attempt);
                log.warn("Embedding attempt {}/{} failed ({}), retrying in {} ms",
                        attempt + 1, retry.maxAttempts(), e.getMessage(), delay.toMillis());
                sleep(delay);
            }
        }
    }

    private float[][] callOnce(List<String> slice) throws TransientFailure {
        Request req;
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", model);
            ArrayNode input = body.putArray("input");
            slice.forEach(input::add);
            body.put("encoding_format", "float");

            req = new Request.Builder()
                    .url(baseUrl + "/embeddings")
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Could not encode embedding request", e);
        }

        try (Response resp = http.newCall(req).execute()) {
            String s = resp.body() != null ? resp.body().string() : "";
            if (resp.code() == 429) {
                throw new TransientFailure("HTTP 429 rate limited", true, retryAfter(resp));
            }
            if (resp.code() >= 500) {
                throw new TransientFailure("HTTP " + resp.code() + " " + resp.message(), false, null);
            }
            if (!resp.isSuccessful()) {
                log.warn("Embedding request rejected: HTTP {} {}", resp.code(), excerpt(s));
                throw new EmbeddingException("Embedding request rejected: HTTP " + resp.code() + " " + excerpt(s));
            }
            if (log.isDebugEnabled()) log.debug("Embedded {} inputs with model {}", slice.size(), model);
            return parse(s, slice.size());
        } catch (IOException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Interrupted during embedding call");
            }
            throw new TransientFailure("I/O error calling " + baseUrl + ": " + e.getMessage(), false, null);
        }
    }

    /** Vectors ordered by the response's {@code index} field. */
    float[][] parse(String body, int expected) {
        JsonNode json;
        try {
            json = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Embedding response is not JSON: " + excerpt(body), e);
        }
        JsonNode data = json == null ? null : json.get("data");
        if (data == null || !data.isArray()) {
            throw new EmbeddingException("Embedding response has no data array");
        }
        if (data.size() != expected) {
            throw new EmbeddingException("Embedding count mismatch: sent " + expected + ", received " + data.size());
        }

        float[][] ordered = new float[expected][];
        for (JsonNode item : data) {
            JsonNode idx = item.get("index");
            if (idx == null || !idx.canConvertToInt()) {
                throw new EmbeddingException("Embedding item without index field");
            }
            int i = idx.asInt();
            if (i < 0 || i >= expected) {
                throw new EmbeddingException("Embedding index " + i + " out of range 0.." + (expected - 1));
            }
            if (ordered[i] != null) {
                throw new EmbeddingException("Duplicate embedding index " + i);
            }
            ordered[i] = toFloatArray(item.get("embedding"), i);
        }
        return ordered;
    }

    private float[] toFloatArray(JsonNode arr, int index) {
        if (arr == null || !arr.isArray() || arr.size() == 0) {
            throw new EmbeddingException("Embedding " + index + " is not a numeric array");
        }
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }

    private static Duration retryAfter(Response resp) {
        String h = resp.header("Retry-After");
        if (h == null) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(h.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static void sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting to retry embedding call");
        }
    }

    private static String excerpt(String s) {
        if (s == null) return "";
        String flat = s.replace("\n", " ");
        return flat.length() > 200 ? flat.substring(0, 200) + "…" : flat;
    }

    private static final class TransientFailure extends Exception {
        private final boolean rateLimited;
        private final Duration retryAfter;

        TransientFailure(String message, boolean rateLimited, Duration retryAfter) {
            super(message);
            this.rateLimited = rateLimited;
            this.retryAfter = retryAfter;
        }
    }
}

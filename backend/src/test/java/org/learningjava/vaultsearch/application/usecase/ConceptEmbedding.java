package org.learningjava.vaultsearch.application.usecase;

import org.learningjava.vaultsearch.application.port.EmbeddingException;
import org.learningjava.vaultsearch.application.port.EmbeddingPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic stand-in for an embedding model: one dimension per topic, counting topic words,
 * plus a small constant so that no vector is zero.
 */
class ConceptEmbedding implements EmbeddingPort {

    private static final List<Set<String>> TOPICS = List.of(
            Set.of("pet", "pets", "dog", "puppy", "walk", "walked", "vet", "leash"),
            Set.of("pasta", "recipe", "cook", "cooked", "sauce", "dinner"),
            Set.of("meeting", "project", "deadline", "budget", "office"));

    final List<Integer> batchSizes = new ArrayList<>();
    final List<String> embedded = new ArrayList<>();
    private final int maxBatch;
    private int failOnCall = -1;

    ConceptEmbedding(int maxBatch) {
        this.maxBatch = maxBatch;
    }

    ConceptEmbedding() {
        this(100);
    }

    /** Makes the n-th call (1-based) throw. */
    ConceptEmbedding failingOnCall(int n) {
        this.failOnCall = n;
        return this;
    }

    int calls() {
        return batchSizes.size();
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        batchSizes.add(texts.size());
        if (batchSizes.size() == failOnCall) throw new EmbeddingException("HTTP 500 simulated");
        embedded.addAll(texts);
        List<float[]> out = new ArrayList<>();
        for (String t : texts) out.add(vector(t));
        return out;
    }

    @Override
    public int maxBatchSize() {
        return maxBatch;
    }

    static float[] vector(String text) {
        float[] v = new float[TOPICS.size() + 1];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            for (int i = 0; i < TOPICS.size(); i++) {
                if (TOPICS.get(i).contains(word)) v[i] += 1f;
            }
        }
        v[TOPICS.size()] = 0.1f;
        return v;
    }
}

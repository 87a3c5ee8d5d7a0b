package org.learningjava.vaultsearch.application.port;

import java.util.List;

public interface EmbeddingPort {

    float[] embed(String text);

    /**
     * One vector per input, in input order, whatever order the provider answered in.
     *
     * @throws EmbeddingException when a batch fails after retries or the response is inconsistent
     */
    List<float[]> embedBatch(List<String> texts);

    /** Largest number of texts sent in one provider request. */
    int maxBatchSize();
}

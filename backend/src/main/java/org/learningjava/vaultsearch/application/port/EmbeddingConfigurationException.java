package org.learningjava.vaultsearch.application.port;

/** Missing API key or model. Never retried. */
public class EmbeddingConfigurationException extends EmbeddingException {

    public EmbeddingConfigurationException(String message) {
        super(message);
    }
}

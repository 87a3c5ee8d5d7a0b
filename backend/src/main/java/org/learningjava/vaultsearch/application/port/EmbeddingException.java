package org.learningjava.vaultsearch.application.port;

/** A failed embedding call: exhausted retries, a non-retryable HTTP status, or a malformed response. */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}

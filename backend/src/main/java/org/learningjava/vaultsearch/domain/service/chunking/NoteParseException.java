package org.learningjava.vaultsearch.domain.service.chunking;

/** Thrown when a note cannot be interpreted, e.g. its frontmatter is not valid YAML. */
public class NoteParseException extends RuntimeException {

    public NoteParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

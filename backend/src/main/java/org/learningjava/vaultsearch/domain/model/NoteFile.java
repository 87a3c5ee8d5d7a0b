package org.learningjava.vaultsearch.domain.model;

import java.time.Instant;

/** Raw content of a note file read from the vault. */
public record NoteFile(String relativePath, String content, Instant modifiedAt) {}

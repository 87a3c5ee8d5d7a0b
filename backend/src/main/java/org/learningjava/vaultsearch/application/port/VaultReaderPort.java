package org.learningjava.vaultsearch.application.port;

import org.learningjava.vaultsearch.domain.model.NoteFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface VaultReaderPort {

    /**
     * Vault-relative paths ('/'-separated, sorted) of files matching an include glob and none of the excludes.
     */
    List<String> listNotes(Path root, List<String> includes, List<String> excludes) throws IOException;

    /** Reads one note as strict UTF-8; malformed bytes are an error, not replaced. */
    NoteFile read(Path root, String relativePath) throws IOException;
}

package org.learningjava.vaultsearch.application.usecase;

import java.nio.file.Path;

/** The configured vault root does not exist or is not a directory. Aborts the whole run. */
public class VaultNotFoundException extends RuntimeException {

    private final Path root;

    public VaultNotFoundException(Path root) {
        super("Vault root not found or not a directory: " + root);
        this.root = root;
    }

    public Path root() {
        return root;
    }
}

package org.learningjava.vaultsearch.infrastructure.adapter.out.fs;

import org.learningjava.vaultsearch.application.port.VaultReaderPort;
import org.learningjava.vaultsearch.domain.model.NoteFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

@Component
public class FileSystemVaultReader implements VaultReaderPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemVaultReader.class);

    @Override
    public List<String> listNotes(Path root, List<String> includes, List<String> excludes) throws IOException {
        List<PathMatcher> in = matchers(includes);
        List<PathMatcher> out = matchers(excludes);

        List<String> notes = new ArrayList<>();
        try (var s = Files.walk(root)) {
            s.filter(Files::isRegularFile).forEach(p -> {
                Path rel = root.relativize(p);
                if (matchesAny(in, rel) && !matchesAny(out, rel)) {
                    notes.add(toVaultPath(rel));
                }
            });
        }
        notes.sort(String::compareTo);
        log.debug("Found {} notes under {}", notes.size(), root);
        return notes;
    }

    @Override
    public NoteFile read(Path root, String relativePath) throws IOException {
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root.normalize())) {
            throw new IOException("Path escapes vault root: " + relativePath);
        }
        byte[] bytes = Files.readAllBytes(file);
        String content = decodeStrict(bytes, relativePath);
        return new NoteFile(relativePath, content, Files.getLastModifiedTime(file).toInstant());
    }

    static String toVaultPath(Path rel) {
        return rel.toString().replace('\\', '/');
    }

    private static String decodeStrict(byte[] bytes, String relativePath) throws IOException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Not valid UTF-8: " + relativePath, e);
        }
    }

    private static List<PathMatcher> matchers(List<String> globs) {
        List<PathMatcher> out = new ArrayList<>();
        if (globs == null) return out;
        var fs = FileSystems.getDefault();
        for (String g : globs) {
            if (g == null || g.isBlank()) continue;
            out.add(fs.getPathMatcher("glob:" + g));
            // a leading "**/" needs at least one directory, so match root-level files separately
            if (g.startsWith("**/")) out.add(fs.getPathMatcher("glob:" + g.substring(3)));
        }
        return out;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path rel) {
        for (PathMatcher m : matchers) {
            if (m.matches(rel)) return true;
        }
        return false;
    }
}

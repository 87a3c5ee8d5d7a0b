package org.learningjava.vaultsearch.domain.service.chunking;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class NoteTitles {

    private static final Pattern FILE_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

    private NoteTitles() {}

    /**
     * Title of a note: frontmatter {@code title}, else the first level-1 header, else the file name
     * without extension.
     */
    public static String resolve(String content, String filePath) {
        String[] lines = NoteChunker.splitLines(content == null ? "" : content);
        Frontmatter fm = Frontmatter.parse(lines);
        var fromFrontmatter = fm.title();
        if (fromFrontmatter.isPresent()) return fromFrontmatter.get();

        for (int i = fm.bodyStartLine(); i < lines.length; i++) {
            String line = lines[i];
            if (line.startsWith("# ")) {
                String h1 = line.substring(2).trim();
                if (!h1.isEmpty()) return h1;
            }
        }
        return baseName(filePath);
    }

    /** File name of a '/'-separated path with its extension removed. */
    public static String baseName(String filePath) {
        String name = filePath;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Date encoded in the file name, e.g. {@code journal/2026-01-18.md}. */
    public static Optional<LocalDate> fileDate(String filePath) {
        if (filePath == null) return Optional.empty();
        Matcher m = FILE_DATE.matcher(baseName(filePath));
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}

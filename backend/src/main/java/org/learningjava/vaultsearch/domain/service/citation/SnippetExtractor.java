package org.learningjava.vaultsearch.domain.service.citation;

import java.util.Arrays;

public final class SnippetExtractor {

    public static final int DEFAULT_MAX_LENGTH = 300;

    private SnippetExtractor() {}

    /**
     * Readable excerpt of a chunk: the leading note prefix is dropped and long text is cut at a sentence
     * or word boundary in its second half, then marked with "...".
     */
    public static String snippet(String chunkText, int maxLength) {
        if (chunkText == null || chunkText.isBlank()) return "";

        String[] lines = chunkText.split("\n", -1);
        int first = 0;
        while (first < lines.length && isPrefixLine(lines[first])) first++;
        String content = String.join("\n", Arrays.asList(lines).subList(first, lines.length)).trim();

        if (content.length() <= maxLength) return content;

        int cut = content.lastIndexOf('.', maxLength);
        if (cut < maxLength / 2) cut = content.lastIndexOf(' ', maxLength);
        if (cut < maxLength / 2) cut = maxLength;
        return content.substring(0, cut).trim() + "...";
    }

    public static String snippet(String chunkText) {
        return snippet(chunkText, DEFAULT_MAX_LENGTH);
    }

    private static boolean isPrefixLine(String line) {
        return line.isBlank()
                || line.startsWith("[Note:")
                || line.startsWith("Date: ")
                || line.startsWith("Tags: ");
    }
}

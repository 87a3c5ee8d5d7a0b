package org.learningjava.vaultsearch.domain.service.citation;

import org.learningjava.vaultsearch.domain.model.Citation;
import org.learningjava.vaultsearch.domain.model.SearchResult;
import org.learningjava.vaultsearch.domain.service.chunking.NoteTitles;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders ranked search hits as {@code obsidian://open} links. Pure formatting, no I/O.
 */
public final class CitationFormatter {

    public static final int DEFAULT_MAX_CITATIONS = 5;

    private CitationFormatter() {}

    public static List<Citation> toCitations(List<SearchResult> results, String vaultName) {
        return results.stream()
                .map(r -> new Citation(
                        r.filePath(),
                        r.title(),
                        NoteTitles.fileDate(r.filePath()).orElse(null),
                        vaultUri(vaultName, r.filePath()),
                        r.score(),
                        SnippetExtractor.snippet(r.chunkText())))
                .toList();
    }

    /**
     * Text block listing up to {@code maxCitations} sources, with a trailing "...and N more" line
     * when truncated. Empty when there is nothing to cite or no vault name to link to.
     */
    public static String format(List<Citation> citations, String vaultName, int maxCitations) {
        if (citations == null || citations.isEmpty() || vaultName == null || vaultName.isBlank()) return "";

        StringBuilder sb = new StringBuilder();
        sb.append("\n---\nSources:\n");
        int shown = Math.min(Math.max(maxCitations, 0), citations.size());
        for (Citation c : citations.subList(0, shown)) {
            sb.append("- [[").append(displayTitle(c)).append("]](")
                    .append(vaultUri(vaultName, c.filePath())).append(")\n");
        }
        if (citations.size() > shown) {
            sb.append("- ...and ").append(citations.size() - shown).append(" more\n");
        }
        return sb.toString();
    }

    public static String format(List<Citation> citations, String vaultName) {
        return format(citations, vaultName, DEFAULT_MAX_CITATIONS);
    }

    public static String vaultUri(String vaultName, String filePath) {
        return "obsidian://open?vault=" + encode(vaultName) + "&file=" + encode(filePath);
    }

    /** Date first, then stored title, then file name. */
    static String displayTitle(Citation c) {
        if (c.noteDate() != null) return c.noteDate().toString();
        if (c.title() != null && !c.title().isBlank()) return c.title();
        return NoteTitles.baseName(c.filePath());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

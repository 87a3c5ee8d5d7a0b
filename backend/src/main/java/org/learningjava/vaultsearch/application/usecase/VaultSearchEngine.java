package org.learningjava.vaultsearch.application.usecase;

import org.learningjava.vaultsearch.application.port.EmbeddingPort;
import org.learningjava.vaultsearch.application.port.VectorIndexPort;
import org.learningjava.vaultsearch.config.VaultProperties;
import org.learningjava.vaultsearch.domain.model.DebugSearch;
import org.learningjava.vaultsearch.domain.model.IndexStats;
import org.learningjava.vaultsearch.domain.model.SearchResult;
import org.learningjava.vaultsearch.domain.model.TranslatedQuery;
import org.learningjava.vaultsearch.domain.service.chunking.NoteTitles;
import org.learningjava.vaultsearch.domain.service.dates.DateQueryTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic search over the indexed vault.
 * <p>
 * Relative dates in the query are resolved first and their literal terms appended before the query is embedded.
 * Twice the requested number of chunks is fetched so that keeping only the best chunk per note still leaves
 * enough notes. The embedding call is not retried here; its failure propagates to the caller.
 */
@Service
public class VaultSearchEngine {

    private static final Logger log = LoggerFactory.getLogger(VaultSearchEngine.class);

    private final EmbeddingPort embedding;
    private final VectorIndexPort index;
    private final DateQueryTranslator translator;
    private final VaultProperties props;
    private final Clock clock;

    public VaultSearchEngine(EmbeddingPort embedding,
                             VectorIndexPort index,
                             DateQueryTranslator translator,
                             VaultProperties props,
                             Clock clock) {
        this.embedding = embedding;
        this.index = index;
        this.translator = translator;
        this.props = props;
        this.clock = clock;
    }

    public List<SearchResult> search(String query) {
        return search(query, null, null);
    }

    /**
     * @param topK     number of notes wanted; configured default when null or not positive
     * @param minScore lowest accepted score; configured default when null
     * @return at most {@code topK} results, one per note, best first
     */
    public List<SearchResult> search(String query, Integer topK, Double minScore) {
        if (!props.getSearch().isEnabled()) {
            log.debug("Vault search disabled, skipping '{}'", query);
            return List.of();
        }
        if (query == null || query.isBlank()) return List.of();
        return run(query, topK, minScore).results();
    }

    public DebugSearch debugSearch(String query, Integer topK, Double minScore) {
        if (!props.getSearch().isEnabled() || query == null || query.isBlank()) {
            String q = query == null ? "" : query;
            return new DebugSearch(TranslatedQuery.unchanged(q), q, 0, List.of(), List.of());
        }
        return run(query, topK, minScore);
    }

    public boolean isAvailable() {
        return props.getSearch().isEnabled() && index.isVectorSearchAvailable();
    }

    public IndexStats stats() {
        return new IndexStats(index.countNotes(), index.countChunks(), index.isVectorSearchAvailable());
    }

    private DebugSearch run(String query, Integer topK, Double minScore) {
        int k = topK != null && topK > 0 ? topK : props.getSearch().getTopK();
        double min = minScore != null ? minScore : props.getSearch().getMinScore();

        TranslatedQuery tq = translator.translate(query, LocalDate.now(clock));
        String combined = tq.combinedQuery();
        if (!tq.dateTerms().isEmpty()) {
            log.debug("Query '{}' resolved to {}..{} with {} date terms",
                    query, tq.startDate(), tq.endDate(), tq.dateTerms().size());
        }

        float[] vector = embedding.embed(combined);
        int fetch = (int) Math.min(2L * k, Integer.MAX_VALUE);
        List<SearchResult> raw = index.nearestNeighbors(vector, fetch, min);

        List<SearchResult> candidates = raw;
        if (props.getSearch().isDateFilter() && tq.hasDateRange()) {
            candidates = withinRange(raw, tq.startDate(), tq.endDate());
        }
        List<SearchResult> results = bestPerNote(candidates, k);
        log.debug("Search '{}': {} hits, {} notes returned", query, raw.size(), results.size());
        return new DebugSearch(tq, combined, fetch, raw, results);
    }

    /** Keeps the highest-scoring hit per file, best first, truncated to {@code k}. */
    static List<SearchResult> bestPerNote(List<SearchResult> hits, int k) {
        Map<String, SearchResult> best = new LinkedHashMap<>();
        for (SearchResult hit : hits) {
            best.merge(hit.filePath(), hit, (a, b) -> b.score() > a.score() ? b : a);
        }
        return best.values().stream()
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                .limit(k)
                .toList();
    }

    /** Drops notes whose file name carries a date outside the range; undated notes pass. */
    static List<SearchResult> withinRange(List<SearchResult> hits, LocalDate start, LocalDate end) {
        return hits.stream()
                .filter(h -> {
                    Optional<LocalDate> d = NoteTitles.fileDate(h.filePath());
                    return d.isEmpty() || (!d.get().isBefore(start) && !d.get().isAfter(end));
                })
                .toList();
    }
}

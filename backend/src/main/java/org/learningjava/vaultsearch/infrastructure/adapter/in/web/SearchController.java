package org.learningjava.vaultsearch.infrastructure.adapter.in.web;

import org.learningjava.vaultsearch.application.port.EmbeddingException;
import org.learningjava.vaultsearch.application.usecase.VaultSearchEngine;
import org.learningjava.vaultsearch.config.VaultProperties;
import org.learningjava.vaultsearch.domain.model.Citation;
import org.learningjava.vaultsearch.domain.model.DebugSearch;
import org.learningjava.vaultsearch.domain.model.IndexStats;
import org.learningjava.vaultsearch.domain.model.SearchResult;
import org.learningjava.vaultsearch.domain.service.citation.CitationFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/vault")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final VaultSearchEngine search;
    private final VaultProperties props;

    public SearchController(VaultSearchEngine search, VaultProperties props) {
        this.search = search;
        this.props = props;
    }

    @GetMapping("/search")
    public SearchResponse search(@RequestParam("q") String q,
                                 @RequestParam(value = "topK", required = false) Integer topK,
                                 @RequestParam(value = "minScore", required = false) Double minScore) {
        requireQuery(q);
        checkRange(topK, minScore);

        List<SearchResult> results;
        try {
            results = search.search(q, topK, minScore);
        } catch (EmbeddingException e) {
            log.error("Search failed for '{}': {}", q, e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Embedding provider failed: " + e.getMessage(), e);
        }

        List<Citation> citations = CitationFormatter.toCitations(results, props.getName());
        String text = CitationFormatter.format(citations, props.getName(), props.getSearch().getMaxCitations());
        return new SearchResponse(q, results, citations, text);
    }

    @GetMapping("/search/debug")
    public DebugSearch debug(@RequestParam("q") String q,
                             @RequestParam(value = "topK", required = false) Integer topK,
                             @RequestParam(value = "minScore", required = false) Double minScore) {
        requireQuery(q);
        checkRange(topK, minScore);
        try {
            return search.debugSearch(q, topK, minScore);
        } catch (EmbeddingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Embedding provider failed: " + e.getMessage(), e);
        }
    }

    @GetMapping("/stats")
    public IndexStats stats() {
        return search.stats();
    }

    @GetMapping("/available")
    public Map<String, Object> available() {
        return Map.of("available", search.isAvailable());
    }

    // ---------- helpers ----------

    private static void requireQuery(String q) {
        if (q == null || q.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Query parameter q is blank");
        }
    }

    private static void checkRange(Integer topK, Double minScore) {
        if (topK != null && topK < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "topK must be >= 1");
        }
        if (minScore != null && (minScore < 0.0 || minScore > 1.0)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "minScore must be within 0..1");
        }
    }

    // ---------- DTOs ----------
    public record SearchResponse(
            String query,
            List<SearchResult> results,
            List<Citation> citations,
            String citationText
    ) {
    }
}

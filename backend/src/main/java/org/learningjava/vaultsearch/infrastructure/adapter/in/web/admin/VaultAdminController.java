package org.learningjava.vaultsearch.infrastructure.adapter.in.web.admin;

import org.learningjava.vaultsearch.application.port.EmbeddingConfigurationException;
import org.learningjava.vaultsearch.application.usecase.VaultIndexer;
import org.learningjava.vaultsearch.application.usecase.VaultNotFoundException;
import org.learningjava.vaultsearch.domain.model.IndexingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

@RestController
@RequestMapping("/vault/admin")
public class VaultAdminController {

    private static final Logger log = LoggerFactory.getLogger(VaultAdminController.class);

    static final String INDEX_JOB = "INDEX";

    private final VaultIndexer indexer;
    private final JobRegistry jobs;
    private final Executor executor;

    public VaultAdminController(VaultIndexer indexer,
                                JobRegistry jobs,
                                @Qualifier("applicationTaskExecutor") Executor executor) {
        this.indexer = indexer;
        this.jobs = jobs;
        this.executor = executor;
    }

    // --- Full vault index, in the background
    @PostMapping("/index")
    public Map<String, Object> indexVault() {
        String jobId = jobs.startIfIdle(INDEX_JOB).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.CONFLICT, "An index job is already running"));
        jobs.update(jobId, "Queued");

        try {
            executor.execute(() -> runIndex(jobId));
        } catch (RejectedExecutionException e) {
            jobs.fail(jobId, "Rejected by executor: " + e.getMessage());
            log.error("[{}] Index job rejected: {}", jobId, e.toString());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Index executor is saturated", e);
        }

        return Map.of("jobId", jobId);
    }

    @PostMapping("/notes/index")
    public IndexingResult indexNote(@RequestParam("path") String path) {
        return guarded(() -> indexer.indexNote(path));
    }

    @DeleteMapping("/notes")
    public IndexingResult removeNote(@RequestParam("path") String path) {
        return guarded(() -> indexer.removeNote(path));
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        return jobs.get(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id));
    }

    // ---------- helpers ----------

    private void runIndex(String jobId) {
        try {
            log.info("[{}] Index start", jobId);
            jobs.update(jobId, "Indexing");
            IndexingResult r = indexer.indexVault();
            String summary = "Added " + r.notesAdded() + ", updated " + r.notesUpdated()
                    + ", removed " + r.notesRemoved() + ", " + r.errors().size() + " errors";
            jobs.done(jobId, summary, r);
            log.info("[{}] Index done: {}", jobId, summary);
        } catch (Exception e) {
            jobs.fail(jobId, e.getMessage());
            log.error("[{}] Index failed: {}", jobId, e.toString(), e);
        }
    }

    private static IndexingResult guarded(Supplier<IndexingResult> call) {
        try {
            return call.get();
        } catch (VaultNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (EmbeddingConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }
}

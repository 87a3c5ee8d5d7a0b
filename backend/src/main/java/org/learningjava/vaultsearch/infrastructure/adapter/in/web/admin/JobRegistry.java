package org.learningjava.vaultsearch.infrastructure.adapter.in.web.admin;

import org.learningjava.vaultsearch.domain.model.IndexingResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory status of background index jobs, keyed by a random id. */
@Component
public class JobRegistry {

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            Instant startedAt,
            Instant finishedAt,
            IndexingResult result
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public synchronized String start(String type) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", Instant.now(), null, null));
        return id;
    }

    /** Starts a job of this type unless one is already running; the check and the start are atomic. */
    public synchronized Optional<String> startIfIdle(String type) {
        if (isRunning(type)) return Optional.empty();
        return Optional.of(start(type));
    }

    public void update(String id, String message) {
        jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.RUNNING,
                message != null ? message : cur.message(), cur.startedAt(), null, cur.result()));
    }

    public void done(String id, String message, IndexingResult result) {
        jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.DONE,
                message != null ? message : "Done", cur.startedAt(), Instant.now(), result));
    }

    public void fail(String id, String message) {
        jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.FAILED,
                message != null ? message : "Failed", cur.startedAt(), Instant.now(), cur.result()));
    }

    public Optional<JobStatus> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /** True while any job of this type is still running. */
    public boolean isRunning(String type) {
        return jobs.values().stream().anyMatch(j -> j.type().equals(type) && j.state() == JobState.RUNNING);
    }
}

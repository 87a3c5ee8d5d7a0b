package org.learningjava.vaultsearch.config;

import org.learningjava.vaultsearch.application.usecase.VaultIndexer;
import org.learningjava.vaultsearch.domain.model.IndexingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/** Optionally kicks off one background index run once the application is up. */
@Component
public class StartupTasks implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final VaultIndexer indexer;
    private final VaultProperties props;
    private final TaskExecutor executor;

    public StartupTasks(VaultIndexer indexer,
                        VaultProperties props,
                        @Qualifier("applicationTaskExecutor") TaskExecutor executor) {
        this.indexer = indexer;
        this.props = props;
        this.executor = executor;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.getIndex().isOnStartup()) {
            log.info("Startup indexing disabled (vault.index.on-startup=false)");
            return;
        }
        log.info("=== Startup indexing of {} ===", props.getPath());
        executor.execute(() -> {
            try {
                IndexingResult r = indexer.indexVault();
                log.info("=== Startup indexing done: added={} updated={} removed={} errors={} ===",
                        r.notesAdded(), r.notesUpdated(), r.notesRemoved(), r.errors().size());
            } catch (Exception e) {
                log.error("Startup indexing failed: {}", e.getMessage(), e);
            }
        });
    }
}

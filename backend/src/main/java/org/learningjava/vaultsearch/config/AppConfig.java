package org.learningjava.vaultsearch.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import okhttp3.OkHttpClient;
import org.learningjava.vaultsearch.application.port.EmbeddingPort;
import org.learningjava.vaultsearch.application.port.VectorIndexPort;
import org.learningjava.vaultsearch.domain.service.chunking.ChunkingOptions;
import org.learningjava.vaultsearch.domain.service.chunking.NoteChunker;
import org.learningjava.vaultsearch.domain.service.dates.DateQueryTranslator;
import org.learningjava.vaultsearch.infrastructure.adapter.out.memory.InMemoryVectorIndexAdapter;
import org.learningjava.vaultsearch.infrastructure.adapter.out.openai.OpenAiEmbeddingAdapter;
import org.learningjava.vaultsearch.infrastructure.adapter.out.openai.RetryPolicy;
import org.learningjava.vaultsearch.infrastructure.adapter.out.postgres.PostgresVectorIndexAdapter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
public class AppConfig {

    @Bean
    Clock clock(VaultProperties props) {
        String zone = props.getSearch().getTimeZone();
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }

    @Bean
    NoteChunker noteChunker(VaultProperties props) {
        var c = props.getChunking();
        return new NoteChunker(new ChunkingOptions(c.getTargetTokens(), c.getOverlapTokens()));
    }

    @Bean
    DateQueryTranslator dateQueryTranslator() {
        return new DateQueryTranslator();
    }

    //objects with external dependencies
    @Bean
    EmbeddingPort embedding(VaultProperties props) {
        var e = props.getEmbedding();
        var r = e.getRetry();
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(e.getTimeout())
                .writeTimeout(e.getTimeout())
                .callTimeout(e.getTimeout())
                .build();
        return new OpenAiEmbeddingAdapter(e.getBaseUrl(), e.getApiKey(), e.getModel(), e.getMaxBatchSize(),
                new RetryPolicy(r.getMaxAttempts(), r.getInitialBackoff(), r.getMaxBackoff(), r.getMultiplier()),
                http);
    }

    @Bean
    @ConditionalOnProperty(name = "vault.store.type", havingValue = "memory", matchIfMissing = true)
    VectorIndexPort inMemoryIndex(Clock clock) {
        VectorIndexPort index = new InMemoryVectorIndexAdapter(clock);
        index.ensureSchema();
        return index;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "vault.store.type", havingValue = "postgres")
    HikariDataSource vaultDataSource(VaultProperties props) {
        var s = props.getStore();
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(s.getJdbcUrl());
        cfg.setUsername(s.getUsername());
        cfg.setPassword(s.getPassword());
        cfg.setMaximumPoolSize(s.getPoolSize());
        cfg.setMinimumIdle(1);
        cfg.setPoolName("vault-index");
        return new HikariDataSource(cfg);
    }

    @Bean
    @ConditionalOnProperty(name = "vault.store.type", havingValue = "postgres")
    VectorIndexPort postgresIndex(HikariDataSource vaultDataSource, VaultProperties props) {
        VectorIndexPort index = new PostgresVectorIndexAdapter(vaultDataSource, props.getStore().getDimensions());
        index.ensureSchema();
        return index;
    }
}

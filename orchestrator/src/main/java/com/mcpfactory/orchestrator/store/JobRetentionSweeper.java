package com.mcpfactory.orchestrator.store;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps the in-memory job history bounded.
 *
 * The JobStore contract has no delete; retention is this sweep's concern.
 * Finished jobs older than {@code mcpfactory.jobs.retention} are dropped on
 * every tick. Running jobs are left alone.
 */
@Component
@EnableScheduling
public class JobRetentionSweeper {

    private final InMemoryJobStore store;
    private final Duration         retention;

    public JobRetentionSweeper(InMemoryJobStore store, FactoryProperties properties) {
        this.store     = store;
        this.retention = properties.getJobs().getRetention();
    }

    @Scheduled(fixedDelayString = "${mcpfactory.jobs.sweep-interval-ms:600000}",
               initialDelayString = "${mcpfactory.jobs.sweep-interval-ms:600000}")
    public void sweep() {
        store.evictTerminalBefore(Instant.now().minus(retention));
    }
}

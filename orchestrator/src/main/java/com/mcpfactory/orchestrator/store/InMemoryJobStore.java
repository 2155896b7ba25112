package com.mcpfactory.orchestrator.store;

import com.mcpfactory.orchestrator.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobStore} backed by a {@link ConcurrentHashMap}.
 *
 * Records are immutable, so a single map operation per write is enough for
 * atomicity: {@code putIfAbsent} for create, {@code compute} for update.
 * Jobs are lost on restart; registered servers live in the registry, not here.
 */
@Component
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    // Newest first; the id breaks ties between jobs created in the same instant.
    private static final Comparator<JobRecord> MOST_RECENT_FIRST =
            Comparator.comparing(JobRecord::createdAt)
                      .thenComparing(JobRecord::id)
                      .reversed();

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();

    @Override
    public void create(String id, JobRecord record) {
        requireMatchingId(id, record);
        if (jobs.putIfAbsent(id, record) != null) {
            throw new DuplicateJobException(id);
        }
    }

    @Override
    public void update(String id, JobRecord record) {
        requireMatchingId(id, record);
        jobs.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new JobNotFoundException(id);
            }
            if (existing.isTerminal()) {
                throw new IllegalStateException("Job " + id + " is "
                        + existing.status().wireName() + " and can no longer change");
            }
            return record;
        });
    }

    @Override
    public Optional<JobRecord> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<JobRecord> list(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        return jobs.values().stream()
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .toList();
    }

    /**
     * Drop terminal jobs that finished before {@code cutoff}.
     * Live jobs are never evicted, however old.
     *
     * @return number of jobs removed
     */
    public int evictTerminalBefore(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, JobRecord> entry : jobs.entrySet()) {
            JobRecord job = entry.getValue();
            if (job.isTerminal() && job.finishedAt().isBefore(cutoff) && jobs.remove(entry.getKey(), job)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted {} finished job(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    public int size() {
        return jobs.size();
    }

    private static void requireMatchingId(String id, JobRecord record) {
        if (!id.equals(record.id())) {
            throw new IllegalArgumentException("Record id '" + record.id() + "' does not match key '" + id + "'");
        }
    }
}

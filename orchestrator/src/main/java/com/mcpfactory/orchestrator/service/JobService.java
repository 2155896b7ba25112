package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.model.JobOptions;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.store.JobIdGenerator;
import com.mcpfactory.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job submission and lookup. The pipeline itself runs in {@link JobStateMachine}.
 */
@Service
@Profile("!standalone")
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStore          store;
    private final JobScheduler      scheduler;
    private final JobIdGenerator    ids;
    private final FactoryProperties props;

    public JobService(JobStore store,
                      JobScheduler scheduler,
                      JobIdGenerator ids,
                      FactoryProperties props) {
        this.store     = store;
        this.scheduler = scheduler;
        this.ids       = ids;
        this.props     = props;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a queued job and hand it to a worker.
     *
     * The job is in the store before this returns, so the caller can poll it
     * straight away.
     *
     * @param runtime null for the default runtime
     * @param docker  null to use {@code mcpfactory.packaging.docker}
     * @throws InvalidSubmissionException if the description is empty
     */
    public String submit(String description, String runtime, Boolean docker) {
        if (description == null || description.isBlank()) {
            throw new InvalidSubmissionException("Description is required");
        }

        JobOptions options = new JobOptions(runtime,
                docker != null ? docker : props.getPackaging().isDocker());
        String id = ids.nextId();
        store.create(id, JobRecord.queued(id, description.strip(), options, Instant.now()));
        log.info("Job {} queued (runtime={}, docker={})", id, options.runtime(), options.docker());

        scheduler.dispatch(id);
        return id;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<JobRecord> find(String id) {
        return store.get(id);
    }

    /** The most recently created jobs, newest first. */
    public List<JobRecord> recent(int limit) {
        return store.list(limit);
    }
}

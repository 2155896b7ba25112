package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.model.PipelineStage;
import com.mcpfactory.orchestrator.store.InMemoryJobStore;
import com.mcpfactory.orchestrator.store.JobIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JobService. The scheduler is mocked so no pipeline runs.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobScheduler   scheduler;
    @Mock JobIdGenerator ids;

    InMemoryJobStore  store;
    FactoryProperties props;
    JobService        service;

    @BeforeEach
    void setUp() {
        store   = spy(new InMemoryJobStore());
        props   = new FactoryProperties();
        service = new JobService(store, scheduler, ids, props);
    }

    @Test
    void submit_createsQueuedJobBeforeDispatching() {
        when(ids.nextId()).thenReturn("job_1_aaaaaaaa");
        doAnswer(inv -> {
            assertThat(store.get("job_1_aaaaaaaa")).isPresent();
            return null;
        }).when(scheduler).dispatch("job_1_aaaaaaaa");

        String id = service.submit("  A weather server  ", null, null);

        assertThat(id).isEqualTo("job_1_aaaaaaaa");
        JobRecord job = store.get(id).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.currentStage()).isEqualTo(PipelineStage.INTERPRET);
        assertThat(job.description()).isEqualTo("A weather server");
        assertThat(job.options().runtime()).isEqualTo("typescript");
        assertThat(job.options().docker()).isFalse();

        InOrder order = inOrder(store, scheduler);
        order.verify(store).create(any(), any());
        order.verify(scheduler).dispatch(id);
    }

    @Test
    void submit_dockerDefaultsFromConfiguration() {
        props.getPackaging().setDocker(true);
        when(ids.nextId()).thenReturn("job_1_bbbbbbbb", "job_1_cccccccc");

        String byDefault  = service.submit("weather", null, null);
        String overridden = service.submit("weather", null, false);

        assertThat(store.get(byDefault).orElseThrow().options().docker()).isTrue();
        assertThat(store.get(overridden).orElseThrow().options().docker()).isFalse();
    }

    @Test
    void submit_blankDescription_isRejectedWithoutCreatingAJob() {
        assertThatThrownBy(() -> service.submit("   ", null, null))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessage("Description is required");

        assertThat(store.size()).isZero();
        verifyNoInteractions(scheduler, ids);
    }

    @Test
    void recent_returnsNewestFirst() {
        when(ids.nextId()).thenReturn("job_1_00000001", "job_2_00000002");
        service.submit("first", null, null);
        service.submit("second", null, null);

        assertThat(service.recent(1)).extracting(JobRecord::description).containsExactly("second");
        assertThat(service.find("job_1_00000001")).isPresent();
        assertThat(service.find("job_nope")).isEmpty();
    }
}

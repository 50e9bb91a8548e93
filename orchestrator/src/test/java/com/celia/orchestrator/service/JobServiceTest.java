package com.celia.orchestrator.service;

import com.celia.orchestrator.llm.ResilientCallClient;
import com.celia.orchestrator.llm.UsageStats;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStats;
import com.celia.orchestrator.model.JobStatus;
import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.store.InMemoryJobStore;
import com.celia.orchestrator.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * All collaborators are mocked with Mockito: no Spring context,
 * no database, no threads.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    static final Instant NOW = Instant.parse("2026-06-01T03:00:00Z");

    @Mock JobStore                store;
    @Mock JobExecutionCoordinator coordinator;
    @Mock ArtifactStore           artifacts;
    @Mock ResilientCallClient     callClient;

    JobProperties properties;
    JobService    service;

    @BeforeEach
    void setUp() {
        properties = new JobProperties();
        service = new JobService(store, coordinator, artifacts, callClient, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_validTask_createsPreparesAndDispatchesInOrder() {
        when(store.create(anyString(), eq("deploy service"), isNull())).thenAnswer(inv ->
                pending(inv.getArgument(0)));

        JobSnapshot job = service.submit("  deploy service  ", null);

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        InOrder order = inOrder(store, artifacts, coordinator);
        order.verify(store).create(job.id(), "deploy service", null);
        order.verify(artifacts).prepare(job.id());
        order.verify(coordinator).submit(job.id());
    }

    @Test
    void submit_artifactDirectoryFails_jobIsMarkedFailedInsteadOfStuckPending() {
        InMemoryJobStore jobs = new InMemoryJobStore(Clock.fixed(NOW, ZoneOffset.UTC));
        JobService withStore = new JobService(jobs, coordinator, artifacts, callClient, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        doThrow(new ArtifactException("Cannot create output directory", new IOException("not a directory")))
                .when(artifacts).prepare(anyString());

        JobSnapshot job = withStore.submit("deploy service", null);

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error()).startsWith("Job could not be started: Cannot create output directory");
        assertThat(jobs.get(job.id()).orElseThrow().status()).isEqualTo(JobStatus.FAILED);
        assertThat(jobs.statusHistory(job.id())).containsExactly(JobStatus.PENDING, JobStatus.FAILED);
        verifyNoInteractions(coordinator);
    }

    @Test
    void submit_coordinatorRejects_jobIsMarkedFailed() {
        InMemoryJobStore jobs = new InMemoryJobStore(Clock.fixed(NOW, ZoneOffset.UTC));
        JobService withStore = new JobService(jobs, coordinator, artifacts, callClient, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(coordinator.submit(anyString())).thenThrow(new RejectedExecutionException("shutting down"));

        JobSnapshot job = withStore.submit("deploy service", null);

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.logs()).contains("[ERROR] Job could not be started: shutting down");
    }

    @Test
    void submit_generatesUniqueUuidIds() {
        when(store.create(anyString(), any(), any())).thenAnswer(inv -> pending(inv.getArgument(0)));

        String first  = service.submit("a", null).id();
        String second = service.submit("b", null).id();

        assertThat(first).isNotEqualTo(second).hasSize(36);
    }

    @Test
    void submit_blankRepoUrl_isTreatedAsAbsent() {
        when(store.create(anyString(), any(), any())).thenAnswer(inv -> pending(inv.getArgument(0)));

        service.submit("task", "   ");

        verify(store).create(anyString(), eq("task"), isNull());
    }

    @Test
    void submit_blankTask_rejectedBeforeAnything() {
        assertThatThrownBy(() -> service.submit("   ", null)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(store, artifacts, coordinator);
    }

    @Test
    void submit_taskTooLong_rejected() {
        String task = "x".repeat(properties.getMaxTaskLength() + 1);

        assertThatThrownBy(() -> service.submit(task, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit: 5000");
        verifyNoInteractions(store);
    }

    @Test
    void submit_repoUrlWithWhitespace_rejected() {
        assertThatThrownBy(() -> service.submit("task", "https://github.com/org/repo.git; rm -rf /"))
                .isInstanceOf(ValidationException.class);
    }

    // ------------------------------------------------------------------
    // list() / stats()
    // ------------------------------------------------------------------

    @Test
    void list_withoutLimit_usesDefault() {
        service.list(null);
        verify(store).list(JobService.DEFAULT_LIST_LIMIT);
    }

    @Test
    void list_limitOutOfRange_rejected() {
        assertThatThrownBy(() -> service.list(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.list(JobService.MAX_LIST_LIMIT + 1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void stats_combinesStoreUsageAndCoordinatorLoad() {
        when(store.stats()).thenReturn(new JobStats(3, Map.of(JobStatus.COMPLETED, 3L)));
        when(callClient.usage()).thenReturn(new UsageStats(5, 1, 100, 50, 2));
        when(coordinator.activeJobs()).thenReturn(1);
        when(coordinator.peakActiveJobs()).thenReturn(3);
        when(coordinator.availableSlots()).thenReturn(2);
        when(coordinator.maxConcurrent()).thenReturn(3);

        PlatformStats stats = service.stats();

        assertThat(stats.jobs().count(JobStatus.COMPLETED)).isEqualTo(3);
        assertThat(stats.usage().failedRequests()).isEqualTo(1);
        assertThat(stats.peakActiveJobs()).isEqualTo(3);
        assertThat(stats.availableSlots()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // delete() / cleanupOldJobs()
    // ------------------------------------------------------------------

    @Test
    void delete_existingJob_removesArtifactsToo() {
        when(store.delete("job-1")).thenReturn(true);

        assertThat(service.delete("job-1")).isTrue();
        verify(artifacts).delete("job-1");
    }

    @Test
    void delete_unknownJob_returnsFalseAndLeavesFilesystemAlone() {
        when(store.delete("missing")).thenReturn(false);

        assertThat(service.delete("missing")).isFalse();
        verifyNoInteractions(artifacts);
    }

    @Test
    void cleanupOldJobs_deletesJobsOlderThanRetention() {
        when(store.deleteCreatedBefore(any())).thenReturn(List.of("old-1", "old-2"));
        doThrow(new ArtifactException("busy", new IOException("locked")))
                .doNothing()
                .when(artifacts).delete(anyString());

        int removed = service.cleanupOldJobs(30);

        assertThat(removed).isEqualTo(2);
        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(store).deleteCreatedBefore(cutoff.capture());
        assertThat(cutoff.getValue()).isEqualTo(NOW.minus(Duration.ofDays(30)));
        // A failing directory delete does not stop the rest.
        verify(artifacts).delete("old-1");
        verify(artifacts).delete("old-2");
    }

    @Test
    void cleanupOldJobs_nonPositiveRetention_rejected() {
        assertThatThrownBy(() -> service.cleanupOldJobs(0)).isInstanceOf(ValidationException.class);
    }

    private static JobSnapshot pending(String id) {
        return new JobSnapshot(id, "task", null, JobStatus.PENDING, "", List.of(), null, NOW, NOW);
    }
}

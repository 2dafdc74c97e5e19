package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.model.Fingerprint;
import Codify.grading.model.GradeStatus;
import Codify.grading.model.GradedResult;
import Codify.grading.model.GradingJob;
import Codify.grading.model.GradingRequest;
import Codify.grading.model.JobStatus;
import Codify.grading.model.SourceUnit;
import Codify.grading.service.dto.WebhookPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("Grading Job Runner Tests")
class GradingJobRunnerTest {

    private static final SourceUnit FIRST = new SourceUnit("a.java", "class A {}");
    private static final SourceUnit SECOND = new SourceUnit("b.java", "class B {}");

    private GradingJobStore jobStore;
    private SubmissionGrader submissionGrader;
    private GradingResultStore resultStore;
    private WebhookNotifier webhookNotifier;
    private GradingJobRunner runner;

    @BeforeEach
    void setUp() {
        jobStore = new GradingJobStore(new MutableClock(Instant.parse("2026-03-01T09:00:00Z")), Duration.ofHours(1));
        submissionGrader = mock(SubmissionGrader.class);
        resultStore = mock(GradingResultStore.class);
        webhookNotifier = mock(WebhookNotifier.class);
        runner = new GradingJobRunner(jobStore, submissionGrader, resultStore, webhookNotifier,
                Runnable::run, new GradingProperties());
    }

    private static GradedResult graded(String name, Integer total, Fingerprint fingerprint) {
        return GradedResult.builder()
                .name(name)
                .valid(true)
                .totalScore(total)
                .hasRubric(true)
                .status(GradeStatus.PASS)
                .fingerprint(fingerprint)
                .build();
    }

    private static GradingRequest request(String callbackUrl, List<SourceUnit> units) {
        return new GradingRequest("Alice", "sorting", "HW1", callbackUrl, units);
    }

    @Test
    @DisplayName("An empty batch should fail the job with a message and no results")
    void emptyBatch_ShouldFailJob() {
        // Given
        GradingJob job = jobStore.create("Alice");

        // When
        runner.run(job.getId(), request(null, List.of()));

        // Then
        GradingJob stored = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals(GradingJobRunner.EMPTY_SUBMISSION, stored.getError());
        assertNull(stored.getResults());
        verifyNoInteractions(submissionGrader, resultStore, webhookNotifier);
    }

    @Test
    @DisplayName("Should grade, decorate, persist, summarize and notify")
    void run_ShouldCompleteJob() {
        // Given
        GradingJob job = jobStore.create("Alice");
        when(submissionGrader.grade(FIRST, "sorting")).thenReturn(graded("a.java", 70, null));
        when(submissionGrader.grade(SECOND, "sorting")).thenReturn(graded("b.java", 81, null));
        when(resultStore.saveBatch(any(), eq("HW1"))).thenReturn(List.of(1L, 2L));

        // When
        runner.run(job.getId(), request("http://hook.test/cb", List.of(FIRST, SECOND)));

        // Then
        GradingJob stored = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals(List.of("Alice | a.java", "Alice | b.java"),
                stored.getResults().stream().map(GradedResult::getName).toList());
        assertEquals(2, stored.getSummary().fileCount());
        assertEquals(Double.valueOf(75.5), stored.getSummary().avgScore());
        assertEquals(2, stored.getSummary().persistedCount());

        ArgumentCaptor<WebhookPayload> payload = ArgumentCaptor.forClass(WebhookPayload.class);
        verify(webhookNotifier).dispatch(eq("http://hook.test/cb"), payload.capture());
        assertEquals(WebhookPayload.GRADING_COMPLETED, payload.getValue().event());
        assertEquals(job.getId(), payload.getValue().jobId());
        assertEquals(stored.getSummary(), payload.getValue().summary());
    }

    @Test
    @DisplayName("Persistence failure should still complete the job with zero persisted")
    void persistenceFailure_ShouldStillComplete() {
        // Given
        GradingJob job = jobStore.create("Alice");
        when(submissionGrader.grade(any(), any())).thenReturn(graded("a.java", 70, null));
        when(resultStore.saveBatch(any(), any())).thenThrow(new IllegalStateException("database down"));

        // When
        runner.run(job.getId(), request(null, List.of(FIRST)));

        // Then
        GradingJob stored = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals(0, stored.getSummary().persistedCount());
        verify(webhookNotifier, never()).dispatch(anyString(), any());
    }

    @Test
    @DisplayName("An unexpected per-file exception should fail the job with its message")
    void unexpectedException_ShouldFailJob() {
        // Given
        GradingJob job = jobStore.create("Alice");
        when(submissionGrader.grade(any(), any())).thenThrow(new IllegalStateException("grader crashed"));

        // When
        runner.run(job.getId(), request("http://hook.test/cb", List.of(FIRST)));

        // Then
        GradingJob stored = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals("grader crashed", stored.getError());
        verifyNoInteractions(resultStore, webhookNotifier);
    }

    @Test
    @DisplayName("Structural duplicates inside one job should both end flagged")
    void duplicatesInBatch_ShouldBeFlagged() {
        // Given
        GradingJob job = jobStore.create("Alice");
        Fingerprint shared = new Fingerprint(Set.of("A-B-C", "B-C-D", "C-D-E"));
        when(submissionGrader.grade(FIRST, "sorting")).thenReturn(graded("a.java", 70, shared));
        when(submissionGrader.grade(SECOND, "sorting")).thenReturn(graded("b.java", 72, shared));
        when(resultStore.saveBatch(any(), any())).thenReturn(List.of(1L, 2L));

        // When
        runner.run(job.getId(), request(null, List.of(FIRST, SECOND)));

        // Then
        List<GradedResult> results = jobStore.find(job.getId()).orElseThrow().getResults();
        assertTrue(results.stream().allMatch(r -> r.getStatus() == GradeStatus.FLAG));
        assertTrue(results.get(0).getNotes().get(0).endsWith("submission b.java"));
        assertTrue(results.get(1).getNotes().get(0).endsWith("submission a.java"));
        assertTrue(results.stream().allMatch(r -> r.fingerprint().isEmpty()));
    }

    @Test
    @DisplayName("A webhook that cannot be scheduled should leave the job completed")
    void webhookRejected_ShouldKeepJobCompleted() {
        // Given
        WebhookNotifier rejecting = new WebhookNotifier(RestClient.create(), task -> {
            throw new RejectedExecutionException("webhook queue full");
        }, 3, Duration.ofMillis(10));
        runner = new GradingJobRunner(jobStore, submissionGrader, resultStore, rejecting,
                Runnable::run, new GradingProperties());
        GradingJob job = jobStore.create("Alice");
        when(submissionGrader.grade(any(), any())).thenReturn(graded("a.java", 70, null));
        when(resultStore.saveBatch(any(), any())).thenReturn(List.of(1L));

        // When
        runner.run(job.getId(), request("http://hook.test/cb", List.of(FIRST)));

        // Then
        GradingJob stored = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertNull(stored.getError());
        assertEquals(1, stored.getResults().size());
    }

    @Test
    @DisplayName("A notifier that throws on dispatch should leave the job completed")
    void webhookDispatchThrows_ShouldKeepJobCompleted() {
        // Given
        GradingJob job = jobStore.create("Alice");
        when(submissionGrader.grade(any(), any())).thenReturn(graded("a.java", 70, null));
        when(resultStore.saveBatch(any(), any())).thenReturn(List.of(1L));
        when(webhookNotifier.dispatch(anyString(), any())).thenThrow(new IllegalStateException("notifier down"));

        // When
        runner.run(job.getId(), request("http://hook.test/cb", List.of(FIRST)));

        // Then
        assertEquals(JobStatus.COMPLETED, jobStore.find(job.getId()).orElseThrow().getStatus());
    }
}

package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.exception.jobexception.JobNotFoundException;
import Codify.grading.model.GradingJob;
import Codify.grading.model.GradingRequest;
import Codify.grading.model.JobStatus;
import Codify.grading.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("Grading Job Service Tests")
class GradingJobServiceTest {

    private MutableClock clock;
    private GradingJobStore jobStore;
    private GradingJobRunner jobRunner;
    private GradingJobService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        jobStore = new GradingJobStore(clock, Duration.ofHours(1));
        jobRunner = mock(GradingJobRunner.class);
        service = new GradingJobService(jobStore, jobRunner, new GradingProperties());
    }

    @Test
    @DisplayName("Submit should create a pending job for an anonymous student and hand it to the runner")
    void submit_ShouldCreateJobAndStartRunner() {
        // Given
        GradingRequest request = new GradingRequest("  ", null, null, null,
                List.of(new SourceUnit("a.java", "class A {}")));

        // When
        GradingJob job = service.submit(request);

        // Then
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals("Anonymous", job.getStudentName());
        ArgumentCaptor<GradingRequest> handed = ArgumentCaptor.forClass(GradingRequest.class);
        verify(jobRunner).run(eq(job.getId()), handed.capture());
        assertEquals("Anonymous", handed.getValue().studentName());
        assertEquals(request.units(), handed.getValue().units());
    }

    @Test
    @DisplayName("Submit should sweep expired jobs first")
    void submit_ShouldSweepEagerly() {
        // Given
        GradingJob old = jobStore.create("Old");
        clock.advance(Duration.ofHours(2));

        // When
        service.submit(new GradingRequest("Bob", null, null, null, List.of()));

        // Then
        assertEquals(1, jobStore.size());
        assertThrows(JobNotFoundException.class, () -> service.status(old.getId()));
    }

    @Test
    @DisplayName("Status of an unknown job should be not found")
    void status_UnknownJob_ShouldThrow() {
        assertThrows(JobNotFoundException.class, () -> service.status(UUID.randomUUID()));
    }

    @Test
    @DisplayName("A job the executor refuses should be failed rather than left pending")
    void submit_RejectedByExecutor_ShouldFailJob() {
        // Given
        doThrow(new TaskRejectedException("grading executor full")).when(jobRunner).run(any(), any());
        GradingRequest request = new GradingRequest("Alice", null, null, null,
                List.of(new SourceUnit("a.java", "class A {}")));

        // When
        assertThrows(TaskRejectedException.class, () -> service.submit(request));

        // Then
        ArgumentCaptor<UUID> jobId = ArgumentCaptor.forClass(UUID.class);
        verify(jobRunner).run(jobId.capture(), any());
        GradingJob stored = service.status(jobId.getValue());
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals("grading executor full", stored.getError());
    }
}

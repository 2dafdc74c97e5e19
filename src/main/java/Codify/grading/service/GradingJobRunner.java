package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.core.SimilarityDetector;
import Codify.grading.model.GradedResult;
import Codify.grading.model.GradingJob;
import Codify.grading.model.GradingRequest;
import Codify.grading.model.JobSummary;
import Codify.grading.service.dto.WebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class GradingJobRunner {
    static final String EMPTY_SUBMISSION = "No valid source files found in submission.";

    private final GradingJobStore jobStore;
    private final SubmissionGrader submissionGrader;
    private final GradingResultStore resultStore;
    private final WebhookNotifier webhookNotifier;
    private final Executor reviewExecutor;
    private final double plagiarismThreshold;

    public GradingJobRunner(GradingJobStore jobStore,
                            SubmissionGrader submissionGrader,
                            GradingResultStore resultStore,
                            WebhookNotifier webhookNotifier,
                            @Qualifier("reviewExecutor") Executor reviewExecutor,
                            GradingProperties properties) {
        this.jobStore = jobStore;
        this.submissionGrader = submissionGrader;
        this.resultStore = resultStore;
        this.webhookNotifier = webhookNotifier;
        this.reviewExecutor = reviewExecutor;
        this.plagiarismThreshold = properties.getPlagiarismThreshold();
    }

    @Async("gradingExecutor")
    public void run(final UUID jobId, final GradingRequest request) {
        jobStore.update(jobId, GradingJob::processing);
        final long started = System.nanoTime();

        if (request.units().isEmpty()) {
            log.error("Job {} failed: {}", jobId, EMPTY_SUBMISSION);
            jobStore.update(jobId, job -> job.failed(EMPTY_SUBMISSION));
            return;
        }

        final List<GradedResult> results;
        final JobSummary summary;
        try {
            results = gradeAll(request);

            // 같은 요청 안에서만 비교
            SimilarityDetector.detect(results, plagiarismThreshold);
            results.forEach(result -> result.decorateWith(request.studentName()));

            final int persisted = persist(jobId, results, request.assignmentCode());
            final double elapsedSeconds = (System.nanoTime() - started) / 1_000_000_000.0;
            summary = JobSummary.of(results, elapsedSeconds, persisted);

            jobStore.update(jobId, job -> job.completed(results, summary));
            log.info("Job {} completed: {} files, avg={}, persisted={}, {}s",
                    jobId, summary.fileCount(), summary.avgScore(), summary.persistedCount(), summary.elapsedSeconds());
        } catch (RuntimeException e) {
            final Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Job {} failed", jobId, cause);
            jobStore.update(jobId, job -> job.failed(messageOf(cause)));
            return;
        }

        // 완료된 job은 웹훅 결과와 무관하게 completed 유지
        if (request.hasCallback()) {
            notifyCallback(jobId, request.callbackUrl(), results, summary);
        }
    }

    private void notifyCallback(UUID jobId, String callbackUrl, List<GradedResult> results, JobSummary summary) {
        try {
            webhookNotifier.dispatch(callbackUrl, WebhookPayload.completed(jobId, results, summary));
        } catch (RuntimeException e) {
            log.error("Webhook dispatch for job {} failed", jobId, e);
        }
    }

    private List<GradedResult> gradeAll(final GradingRequest request) {
        final List<CompletableFuture<GradedResult>> futures = request.units().stream()
                .map(unit -> CompletableFuture.supplyAsync(
                        () -> submissionGrader.grade(unit, request.topic()), reviewExecutor))
                .toList();

        // 모든 파일이 끝난 뒤에 유사도 검사
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    // 저장 실패는 job 실패가 아니다
    private int persist(final UUID jobId, final List<GradedResult> results, final String assignmentCode) {
        try {
            return resultStore.saveBatch(results, assignmentCode).size();
        } catch (RuntimeException e) {
            log.error("Failed to persist results for job {}", jobId, e);
            return 0;
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

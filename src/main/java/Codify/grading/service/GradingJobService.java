package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.exception.jobexception.JobNotFoundException;
import Codify.grading.model.GradingJob;
import Codify.grading.model.GradingRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class GradingJobService {
    private final GradingJobStore jobStore;
    private final GradingJobRunner jobRunner;
    private final GradingProperties properties;

    // 비동기 실행, job id는 바로 반환
    public GradingJob submit(final GradingRequest request) {
        final int removed = jobStore.sweepExpired();
        if (removed > 0) {
            log.info("Cleaned up {} expired grading jobs", removed);
        }

        final String studentName = resolveStudentName(request.studentName());
        final GradingJob job = jobStore.create(studentName);
        log.info("Job {} accepted: {} files (student={}, topic={})",
                job.getId(), request.units().size(), job.getStudentName(), request.topic());
        try {
            jobRunner.run(job.getId(), request.withStudentName(studentName));
        } catch (RejectedExecutionException e) {
            // 실행되지 못한 job이 pending으로 남지 않게 한다
            log.error("Job {} rejected by grading executor", job.getId(), e);
            jobStore.update(job.getId(), rejected -> rejected.failed(e.getMessage() != null
                    ? e.getMessage() : e.getClass().getSimpleName()));
            throw e;
        }
        return job;
    }

    public GradingJob status(final UUID jobId) {
        return jobStore.find(jobId).orElseThrow(JobNotFoundException::new);
    }

    private String resolveStudentName(final String studentName) {
        return studentName == null || studentName.isBlank()
                ? properties.getAnonymousStudentName()
                : studentName.strip();
    }
}

package Codify.grading.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

// 갱신은 항상 레코드 전체 교체
@Value
@Builder(toBuilder = true)
public class GradingJob {
    UUID id;
    JobStatus status;
    Instant createdAt;
    String studentName;
    List<GradedResult> results;
    JobSummary summary;
    String error;

    public static GradingJob pending(UUID id, Instant createdAt, String studentName) {
        return GradingJob.builder()
                .id(id)
                .status(JobStatus.PENDING)
                .createdAt(createdAt)
                .studentName(studentName)
                .build();
    }

    public GradingJob processing() {
        return toBuilder().status(JobStatus.PROCESSING).build();
    }

    public GradingJob completed(List<GradedResult> results, JobSummary summary) {
        return toBuilder()
                .status(JobStatus.COMPLETED)
                .results(List.copyOf(results))
                .summary(summary)
                .build();
    }

    public GradingJob failed(String error) {
        return toBuilder().status(JobStatus.FAILED).error(error).build();
    }
}

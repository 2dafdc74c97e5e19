package Codify.grading.web.dto;

import Codify.grading.model.GradedResult;
import Codify.grading.model.GradingJob;
import Codify.grading.model.JobStatus;
import Codify.grading.model.JobSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GradingStatusResponseDto(
        UUID jobId,
        JobStatus status,
        Instant createdAt,
        String studentName,
        List<GradedResult> results,
        JobSummary summary,
        String error
) {
    public static GradingStatusResponseDto from(GradingJob job) {
        return new GradingStatusResponseDto(job.getId(), job.getStatus(), job.getCreatedAt(),
                job.getStudentName(), job.getResults(), job.getSummary(), job.getError());
    }
}

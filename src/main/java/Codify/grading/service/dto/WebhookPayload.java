package Codify.grading.service.dto;

import Codify.grading.model.GradedResult;
import Codify.grading.model.JobSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WebhookPayload(String event, UUID jobId, List<GradedResult> results, JobSummary summary) {
    public static final String GRADING_COMPLETED = "grading_completed";

    public static WebhookPayload completed(UUID jobId, List<GradedResult> results, JobSummary summary) {
        return new WebhookPayload(GRADING_COMPLETED, jobId, results, summary);
    }
}

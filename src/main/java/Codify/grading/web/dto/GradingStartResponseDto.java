package Codify.grading.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GradingStartResponseDto(
        UUID jobId,
        String status,
        String message,
        String callbackUrl
) {
    public static GradingStartResponseDto accepted(UUID jobId, int fileCount, String callbackUrl) {
        return new GradingStartResponseDto(jobId, "accepted",
                "Grading " + fileCount + " file(s) in background.", callbackUrl);
    }
}

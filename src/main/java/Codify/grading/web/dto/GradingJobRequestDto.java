package Codify.grading.web.dto;

import Codify.grading.model.GradingRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

// units가 비어 있으면 job은 생성되지만 바로 실패한다
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GradingJobRequestDto(
        String studentName,
        String topic,
        String assignmentCode,
        String callbackUrl,
        @NotNull(message = "units must not be null")
        List<@Valid @NotNull SourceUnitDto> units
) {
    public GradingRequest toGradingRequest() {
        return new GradingRequest(studentName, topic, assignmentCode, callbackUrl,
                units.stream().map(SourceUnitDto::toSourceUnit).toList());
    }
}

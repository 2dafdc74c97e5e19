package Codify.grading.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssignmentScoresResponseDto(String assignmentCode, List<GradeRecordResponseDto> submissions, int total) {
    public static AssignmentScoresResponseDto of(String assignmentCode, List<GradeRecordResponseDto> submissions) {
        return new AssignmentScoresResponseDto(assignmentCode, submissions, submissions.size());
    }
}

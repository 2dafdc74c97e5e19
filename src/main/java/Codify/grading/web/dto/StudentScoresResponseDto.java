package Codify.grading.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StudentScoresResponseDto(String studentId, List<GradeRecordResponseDto> submissions, int total) {
    public static StudentScoresResponseDto of(String studentId, List<GradeRecordResponseDto> submissions) {
        return new StudentScoresResponseDto(studentId, submissions, submissions.size());
    }
}

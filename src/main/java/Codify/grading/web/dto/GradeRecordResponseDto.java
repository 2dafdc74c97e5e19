package Codify.grading.web.dto;

import Codify.grading.domain.GradeRecord;
import Codify.grading.model.GradeStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GradeRecordResponseDto(
        Long id,
        String studentId,
        String studentName,
        String assignmentCode,
        String filename,
        Integer totalScore,
        Integer logicScore,
        Integer algorithmScore,
        Integer styleScore,
        Integer optimizationScore,
        String algorithms,
        int complexity,
        GradeStatus status,
        String reasoning,
        String improvement,
        String notes,
        boolean aiScored,
        LocalDateTime submittedAt
) {
    public static GradeRecordResponseDto from(GradeRecord record) {
        return new GradeRecordResponseDto(record.getId(), record.getStudentId(), record.getStudentName(),
                record.getAssignmentCode(), record.getFilename(), record.getTotalScore(), record.getLogicScore(),
                record.getAlgorithmScore(), record.getStyleScore(), record.getOptimizationScore(),
                record.getAlgorithms(), record.getComplexity(), record.getStatus(), record.getReasoning(),
                record.getImprovement(), record.getNotes(), record.isAiScored(), record.getSubmittedAt());
    }
}

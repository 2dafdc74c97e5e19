package Codify.grading.web.dto;

import Codify.grading.repository.GradeStatsView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GradeStatsResponseDto(
        String assignmentCode,
        long totalSubmissions,
        double avgScore,
        int maxScore,
        int minScore,
        long passed,
        long failed,
        long flagged
) {
    // 행이 없거나 점수가 하나도 없으면 0으로 채운다
    public static GradeStatsResponseDto from(String assignmentCode, GradeStatsView view) {
        if (view == null) {
            return new GradeStatsResponseDto(assignmentCode, 0, 0.0, 0, 0, 0, 0, 0);
        }
        return new GradeStatsResponseDto(
                assignmentCode,
                orZero(view.getTotalSubmissions()),
                view.getAvgScore() == null ? 0.0 : Math.round(view.getAvgScore() * 10.0) / 10.0,
                view.getMaxScore() == null ? 0 : view.getMaxScore(),
                view.getMinScore() == null ? 0 : view.getMinScore(),
                orZero(view.getPassed()),
                orZero(view.getFailed()),
                orZero(view.getFlagged()));
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}

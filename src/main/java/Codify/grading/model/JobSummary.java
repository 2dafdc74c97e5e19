package Codify.grading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobSummary(int fileCount, Double avgScore, double elapsedSeconds, int persistedCount) {

    // 점수가 없는(PENDING) 결과는 평균에서 제외
    public static JobSummary of(List<GradedResult> results, double elapsedSeconds, int persistedCount) {
        OptionalDouble avg = results.stream()
                .map(GradedResult::getTotalScore)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();
        Double avgScore = avg.isPresent() ? roundOneDecimal(avg.getAsDouble()) : null;
        return new JobSummary(results.size(), avgScore, roundOneDecimal(elapsedSeconds), persistedCount);
    }

    private static double roundOneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}

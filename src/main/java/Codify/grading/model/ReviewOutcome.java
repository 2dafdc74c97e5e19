package Codify.grading.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

// 채점 기준이 없으면 totalScore는 null
@Value
@Builder
public class ReviewOutcome {
    Integer totalScore;
    ScoreBreakdown breakdown;
    boolean hasRubric;
    String detectedAlgorithm;
    String strengths;
    String weaknesses;
    String reasoning;
    String improvement;
    String complexityAnalysis;
    @Builder.Default
    List<String> notes = List.of();
    boolean aiScored;
}

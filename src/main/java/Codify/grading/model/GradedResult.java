package Codify.grading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GradedResult implements SimilarityCandidate {
    static final String DECORATION_SEPARATOR = " | ";
    private static final String BASIC_LOGIC = "Basic Logic";

    private String name;
    private final boolean valid;
    private final Integer totalScore;
    private final ScoreBreakdown breakdown;
    private final boolean hasRubric;
    private GradeStatus status;
    private final List<String> algorithms;
    private final String detectedAlgorithm;
    private final int complexity;
    private final int maxLoopDepth;
    private final long runtimeMillis;
    private final String strengths;
    private final String weaknesses;
    private final String reasoning;
    private final String improvement;
    private final String complexityAnalysis;
    @Getter(AccessLevel.NONE)
    private final List<String> notes;
    private final boolean aiScored;
    @Getter(AccessLevel.NONE)
    private Fingerprint fingerprint;

    @Builder
    private GradedResult(String name, boolean valid, Integer totalScore, ScoreBreakdown breakdown, boolean hasRubric,
                         GradeStatus status, List<String> algorithms, String detectedAlgorithm, int complexity,
                         int maxLoopDepth, long runtimeMillis, String strengths, String weaknesses, String reasoning,
                         String improvement, String complexityAnalysis, List<String> notes, boolean aiScored,
                         Fingerprint fingerprint) {
        this.name = name;
        this.valid = valid;
        this.totalScore = totalScore;
        this.breakdown = breakdown;
        this.hasRubric = hasRubric;
        this.status = status == null ? GradeStatus.PENDING : status;
        this.algorithms = algorithms == null ? List.of() : List.copyOf(algorithms);
        this.detectedAlgorithm = detectedAlgorithm;
        this.complexity = complexity;
        this.maxLoopDepth = maxLoopDepth;
        this.runtimeMillis = runtimeMillis;
        this.strengths = strengths;
        this.weaknesses = weaknesses;
        this.reasoning = reasoning;
        this.improvement = improvement;
        this.complexityAnalysis = complexityAnalysis;
        this.notes = notes == null ? new ArrayList<>() : new ArrayList<>(notes);
        this.aiScored = aiScored;
        this.fingerprint = fingerprint;
    }

    // PASS/FAIL은 점수와 채점 기준이 모두 있을 때만, FLAG는 유지
    public static GradedResult merge(AnalysisResult analysis, ReviewOutcome review, int passScoreThreshold) {
        GradeStatus status;
        if (analysis.getStatus() == GradeStatus.FLAG) {
            status = GradeStatus.FLAG;
        } else if (review.getTotalScore() != null && review.isHasRubric()) {
            status = review.getTotalScore() >= passScoreThreshold ? GradeStatus.PASS : GradeStatus.FAIL;
        } else {
            status = GradeStatus.PENDING;
        }

        List<String> merged = new ArrayList<>(analysis.getNotes());
        merged.addAll(review.getNotes());

        return GradedResult.builder()
                .name(analysis.getName())
                .valid(true)
                .totalScore(review.getTotalScore())
                .breakdown(review.getBreakdown())
                .hasRubric(review.isHasRubric())
                .status(status)
                .algorithms(analysis.getAlgorithms())
                .detectedAlgorithm(review.getDetectedAlgorithm() != null
                        ? review.getDetectedAlgorithm()
                        : labelOf(analysis.getAlgorithms()))
                .complexity(analysis.getComplexity())
                .maxLoopDepth(analysis.getMaxLoopDepth())
                .runtimeMillis(analysis.getRuntimeMillis())
                .strengths(review.getStrengths())
                .weaknesses(review.getWeaknesses())
                .reasoning(review.getReasoning())
                .improvement(review.getImprovement())
                .complexityAnalysis(review.getComplexityAnalysis())
                .notes(merged)
                .aiScored(review.isAiScored())
                .fingerprint(analysis.fingerprint().orElse(null))
                .build();
    }

    // 분석 단계에서 중단된 결과는 리뷰 없이 0점으로 그대로 내려보낸다
    public static GradedResult fromInvalid(AnalysisResult analysis) {
        return GradedResult.builder()
                .name(analysis.getName())
                .valid(false)
                .totalScore(0)
                .status(analysis.getStatus())
                .detectedAlgorithm("Analysis failed")
                .notes(analysis.getNotes())
                .build();
    }

    public static String labelOf(List<String> algorithms) {
        return algorithms.isEmpty() ? BASIC_LOGIC : String.join(", ", algorithms);
    }

    public void decorateWith(String studentName) {
        if (!name.contains(DECORATION_SEPARATOR)) {
            name = studentName + DECORATION_SEPARATOR + name;
        }
    }

    public List<String> getNotes() {
        return List.copyOf(notes);
    }

    @Override
    public Optional<Fingerprint> fingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    @Override
    public void flagDuplicate(String note) {
        if (!notes.contains(note)) {
            notes.add(note);
        }
        status = GradeStatus.FLAG;
    }

    @Override
    public void discardFingerprint() {
        fingerprint = null;
    }
}

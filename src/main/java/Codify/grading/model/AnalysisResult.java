package Codify.grading.model;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
public class AnalysisResult implements SimilarityCandidate {
    private final String name;
    private final boolean valid;
    private final List<String> algorithms;
    private final int complexity;
    private final int maxLoopDepth;
    private final ScoreBreakdown fallbackScore;
    private final String featureSummary;
    private final long runtimeMillis;
    private final List<String> notes;
    private GradeStatus status;
    private Fingerprint fingerprint;

    @Builder
    private AnalysisResult(String name, boolean valid, List<String> algorithms, int complexity, int maxLoopDepth,
                           ScoreBreakdown fallbackScore, String featureSummary, long runtimeMillis,
                           List<String> notes, GradeStatus status, Fingerprint fingerprint) {
        this.name = name;
        this.valid = valid;
        this.algorithms = algorithms == null ? List.of() : List.copyOf(algorithms);
        this.complexity = complexity;
        this.maxLoopDepth = maxLoopDepth;
        this.fallbackScore = fallbackScore;
        this.featureSummary = featureSummary;
        this.runtimeMillis = runtimeMillis;
        this.notes = notes == null ? new ArrayList<>() : new ArrayList<>(notes);
        this.status = status == null ? GradeStatus.PENDING : status;
        this.fingerprint = fingerprint;
    }

    // 구문 오류(FAIL) 또는 보안 위반(FLAG)으로 분석이 중단된 결과
    public static AnalysisResult invalid(String name, GradeStatus status, List<String> notes) {
        return AnalysisResult.builder()
                .name(name)
                .valid(false)
                .status(status)
                .notes(notes)
                .build();
    }

    public Optional<ScoreBreakdown> fallbackScore() {
        return Optional.ofNullable(fallbackScore);
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

    public List<String> getNotes() {
        return List.copyOf(notes);
    }
}

package Codify.grading.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graded Result Tests")
class GradedResultTest {

    private static final int PASS_SCORE = 50;

    private static AnalysisResult analysis(GradeStatus status, List<String> algorithms) {
        return AnalysisResult.builder()
                .name("main.java")
                .valid(true)
                .algorithms(algorithms)
                .complexity(4)
                .maxLoopDepth(2)
                .notes(List.of("analysis note"))
                .status(status)
                .fingerprint(new Fingerprint(Set.of("A-B-C")))
                .build();
    }

    private static ReviewOutcome scored(Integer total, boolean hasRubric) {
        return ReviewOutcome.builder()
                .totalScore(total)
                .breakdown(total == null ? null : ScoreBreakdown.reviewed(total, 30, 30, 8, 7))
                .hasRubric(hasRubric)
                .notes(List.of("review note"))
                .aiScored(true)
                .build();
    }

    @Test
    @DisplayName("Should decide PASS or FAIL only with a score and a rubric")
    void merge_ShouldResolveStatus() {
        assertEquals(GradeStatus.PASS,
                GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(72, true), PASS_SCORE).getStatus());
        assertEquals(GradeStatus.PASS,
                GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(50, true), PASS_SCORE).getStatus());
        assertEquals(GradeStatus.FAIL,
                GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(30, true), PASS_SCORE).getStatus());
        assertEquals(GradeStatus.PENDING,
                GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(null, false), PASS_SCORE).getStatus());
        assertEquals(GradeStatus.PENDING,
                GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(80, false), PASS_SCORE).getStatus());
    }

    @Test
    @DisplayName("FLAG should survive a passing review")
    void merge_ShouldKeepFlag() {
        // When
        GradedResult result = GradedResult.merge(analysis(GradeStatus.FLAG, List.of()), scored(95, true), PASS_SCORE);

        // Then
        assertEquals(GradeStatus.FLAG, result.getStatus());
    }

    @Test
    @DisplayName("Should concatenate notes and label by detected algorithms when the reviewer gives none")
    void merge_ShouldCombineNotesAndLabel() {
        // When
        GradedResult tagged = GradedResult.merge(
                analysis(GradeStatus.PENDING, List.of("Bubble Sort", "Nested Loops")), scored(60, true), PASS_SCORE);
        GradedResult plain = GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(60, true), PASS_SCORE);

        // Then
        assertEquals(List.of("analysis note", "review note"), tagged.getNotes());
        assertEquals("Bubble Sort, Nested Loops", tagged.getDetectedAlgorithm());
        assertEquals("Basic Logic", plain.getDetectedAlgorithm());
        assertTrue(tagged.fingerprint().isPresent());
    }

    @Test
    @DisplayName("Invalid analysis should become a zero score carrying its status and notes")
    void fromInvalid_ShouldScoreZero() {
        // Given
        AnalysisResult invalid = AnalysisResult.invalid("bad.java", GradeStatus.FLAG,
                List.of("Security violation", "Forbidden import: java.net.Socket"));

        // When
        GradedResult result = GradedResult.fromInvalid(invalid);

        // Then
        assertFalse(result.isValid());
        assertEquals(Integer.valueOf(0), result.getTotalScore());
        assertNull(result.getBreakdown());
        assertEquals(GradeStatus.FLAG, result.getStatus());
        assertEquals("Analysis failed", result.getDetectedAlgorithm());
        assertEquals(invalid.getNotes(), result.getNotes());
    }

    @Test
    @DisplayName("Should prefix the student once and never twice")
    void decorateWith_ShouldBeIdempotent() {
        // Given
        GradedResult result = GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(60, true), PASS_SCORE);

        // When
        result.decorateWith("Alice");
        result.decorateWith("Alice");

        // Then
        assertEquals("Alice | main.java", result.getName());
    }

    @Test
    @DisplayName("Should not append the same duplicate note twice")
    void flagDuplicate_ShouldDeduplicateNotes() {
        // Given
        GradedResult result = GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(60, true), PASS_SCORE);

        // When
        result.flagDuplicate("WARNING: 90% structural overlap with submission b.java");
        result.flagDuplicate("WARNING: 90% structural overlap with submission b.java");

        // Then
        assertEquals(GradeStatus.FLAG, result.getStatus());
        assertEquals(3, result.getNotes().size());
    }

    @Test
    @DisplayName("Serialized form should use snake_case and never expose the fingerprint")
    void json_ShouldHideFingerprint() throws Exception {
        // Given
        GradedResult result = GradedResult.merge(analysis(GradeStatus.PENDING, List.of()), scored(60, true), PASS_SCORE);

        // When
        String json = new ObjectMapper().writeValueAsString(result);

        // Then
        assertTrue(json.contains("\"total_score\":60"));
        assertTrue(json.contains("\"has_rubric\":true"));
        assertTrue(json.contains("\"ai_scored\":true"));
        assertFalse(json.contains("fingerprint"));
        assertFalse(json.contains("A-B-C"));
    }
}

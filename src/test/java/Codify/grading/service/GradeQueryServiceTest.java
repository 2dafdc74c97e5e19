package Codify.grading.service;

import Codify.grading.domain.GradeRecord;
import Codify.grading.model.GradeStatus;
import Codify.grading.repository.GradeRecordRepository;
import Codify.grading.repository.GradeStatsView;
import Codify.grading.web.dto.AssignmentScoresResponseDto;
import Codify.grading.web.dto.GradeStatsResponseDto;
import Codify.grading.web.dto.StudentScoresResponseDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Grade Query Service Tests")
class GradeQueryServiceTest {

    private GradeRecordRepository repository;
    private GradeQueryService service;

    @BeforeEach
    void setUp() {
        repository = mock(GradeRecordRepository.class);
        service = new GradeQueryService(repository);
    }

    private static GradeRecord record(long id, String studentId, Integer total, GradeStatus status) {
        return GradeRecord.builder()
                .id(id)
                .studentId(studentId)
                .studentName("Kim")
                .assignmentCode("HW1")
                .filename(studentId + " - Kim | sort.java")
                .totalScore(total)
                .status(status)
                .submittedAt(LocalDateTime.of(2026, 3, 1, 9, 0))
                .build();
    }

    @Test
    @DisplayName("Student history should list every stored submission with its count")
    void studentScores_ShouldMapRecords() {
        // Given
        when(repository.findByStudentIdOrderBySubmittedAtDesc("20201234")).thenReturn(List.of(
                record(2L, "20201234", 81, GradeStatus.PASS),
                record(1L, "20201234", 40, GradeStatus.FAIL)));

        // When
        StudentScoresResponseDto response = service.studentScores("20201234");

        // Then
        assertEquals("20201234", response.studentId());
        assertEquals(2, response.total());
        assertEquals(Long.valueOf(2L), response.submissions().get(0).id());
        assertEquals(Integer.valueOf(81), response.submissions().get(0).totalScore());
    }

    @Test
    @DisplayName("An assignment without records should give an empty score table")
    void assignmentScores_Empty() {
        when(repository.findByAssignmentCodeOrderByTotalScoreDesc("HW9")).thenReturn(List.of());

        AssignmentScoresResponseDto response = service.assignmentScores("HW9");

        assertEquals("HW9", response.assignmentCode());
        assertEquals(0, response.total());
        assertTrue(response.submissions().isEmpty());
    }

    @Test
    @DisplayName("Stats should round the average and pass the assignment filter through")
    void stats_ShouldRoundAverage() {
        // Given
        GradeStatsView view = mock(GradeStatsView.class);
        when(view.getTotalSubmissions()).thenReturn(3L);
        when(view.getAvgScore()).thenReturn(66.666);
        when(view.getMaxScore()).thenReturn(90);
        when(view.getMinScore()).thenReturn(40);
        when(view.getPassed()).thenReturn(2L);
        when(view.getFailed()).thenReturn(1L);
        when(view.getFlagged()).thenReturn(0L);
        when(repository.aggregateStats("HW1")).thenReturn(view);

        // When
        GradeStatsResponseDto stats = service.stats(" HW1 ");

        // Then
        assertEquals(new GradeStatsResponseDto("HW1", 3, 66.7, 90, 40, 2, 1, 0), stats);
    }

    @Test
    @DisplayName("Stats over no scored rows should be all zeros")
    void stats_NoRows_ShouldBeZero() {
        // Given
        GradeStatsView view = mock(GradeStatsView.class);
        when(view.getTotalSubmissions()).thenReturn(0L);
        when(repository.aggregateStats(null)).thenReturn(view);

        // When
        GradeStatsResponseDto stats = service.stats("  ");

        // Then
        assertEquals(new GradeStatsResponseDto(null, 0, 0.0, 0, 0, 0, 0, 0), stats);
        verify(repository).aggregateStats(null);
    }
}

package Codify.grading.service;

import Codify.grading.repository.GradeRecordRepository;
import Codify.grading.web.dto.AssignmentScoresResponseDto;
import Codify.grading.web.dto.GradeRecordResponseDto;
import Codify.grading.web.dto.GradeStatsResponseDto;
import Codify.grading.web.dto.StudentScoresResponseDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GradeQueryService {
    private final GradeRecordRepository gradeRecordRepository;

    // 최근 제출 순
    public StudentScoresResponseDto studentScores(final String studentId) {
        final List<GradeRecordResponseDto> submissions = gradeRecordRepository
                .findByStudentIdOrderBySubmittedAtDesc(studentId).stream()
                .map(GradeRecordResponseDto::from)
                .toList();
        return StudentScoresResponseDto.of(studentId, submissions);
    }

    // 점수 높은 순
    public AssignmentScoresResponseDto assignmentScores(final String assignmentCode) {
        final List<GradeRecordResponseDto> submissions = gradeRecordRepository
                .findByAssignmentCodeOrderByTotalScoreDesc(assignmentCode).stream()
                .map(GradeRecordResponseDto::from)
                .toList();
        return AssignmentScoresResponseDto.of(assignmentCode, submissions);
    }

    public GradeStatsResponseDto stats(final String assignmentCode) {
        final String code = assignmentCode == null || assignmentCode.isBlank() ? null : assignmentCode.strip();
        return GradeStatsResponseDto.from(code, gradeRecordRepository.aggregateStats(code));
    }
}

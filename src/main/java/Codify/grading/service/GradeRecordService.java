package Codify.grading.service;

import Codify.grading.domain.GradeRecord;
import Codify.grading.model.GradedResult;
import Codify.grading.model.ScoreBreakdown;
import Codify.grading.repository.GradeRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GradeRecordService implements GradingResultStore {
    static final String ANONYMOUS_ID = "anonymous";
    static final String UNKNOWN_NAME = "Unknown";

    private final GradeRecordRepository gradeRecordRepository;
    private final Clock clock;

    @Override
    @Transactional
    public List<Long> saveBatch(final List<GradedResult> results, final String assignmentCode) {
        final LocalDateTime now = LocalDateTime.now(clock);
        final List<GradeRecord> records = results.stream()
                .map(result -> toRecord(result, assignmentCode, now))
                .toList();

        final List<Long> ids = gradeRecordRepository.saveAll(records).stream()
                .map(GradeRecord::getId)
                .toList();
        log.info("Saved {} grade records (assignment={})", ids.size(), assignmentCode);
        return ids;
    }

    private static GradeRecord toRecord(GradedResult result, String assignmentCode, LocalDateTime submittedAt) {
        final StudentInfo student = parseStudentInfo(result.getName());
        final ScoreBreakdown breakdown = result.getBreakdown();

        return GradeRecord.builder()
                .studentId(student.id())
                .studentName(student.name())
                .assignmentCode(assignmentCode)
                .filename(result.getName())
                .totalScore(result.getTotalScore())
                .logicScore(breakdown == null ? null : breakdown.logic())
                .algorithmScore(breakdown == null ? null : breakdown.algorithm())
                .styleScore(breakdown == null ? null : breakdown.style())
                .optimizationScore(breakdown == null ? null : breakdown.optimization())
                .algorithms(result.getDetectedAlgorithm())
                .complexity(result.getComplexity())
                .status(result.getStatus())
                .reasoning(result.getReasoning())
                .improvement(result.getImprovement())
                .notes(String.join("\n", result.getNotes()))
                .aiScored(result.isAiScored())
                .runtimeMillis(result.getRuntimeMillis())
                .submittedAt(submittedAt)
                .build();
    }

    // "MSSV - 이름 | 파일명" 또는 "이름 | 파일명"
    static StudentInfo parseStudentInfo(String filename) {
        if (filename == null || !filename.contains(" | ")) {
            return new StudentInfo(ANONYMOUS_ID, UNKNOWN_NAME);
        }
        final String info = filename.substring(0, filename.indexOf(" | "));
        final int dash = info.indexOf(" - ");
        if (dash >= 0) {
            return new StudentInfo(info.substring(0, dash).strip(), info.substring(dash + 3).strip());
        }
        return new StudentInfo(ANONYMOUS_ID, info.strip());
    }

    record StudentInfo(String id, String name) {}
}

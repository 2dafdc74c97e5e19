package Codify.grading.repository;

import Codify.grading.domain.GradeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface GradeRecordRepository extends JpaRepository<GradeRecord, Long> {
    List<GradeRecord> findByStudentIdOrderBySubmittedAtDesc(String studentId);

    List<GradeRecord> findByAssignmentCodeOrderByTotalScoreDesc(String assignmentCode);

    // 점수 통계는 점수가 있는 행만, 개수는 전체 행 기준
    @Query("""
            select count(g) as totalSubmissions,
                   avg(g.totalScore) as avgScore,
                   max(g.totalScore) as maxScore,
                   min(g.totalScore) as minScore,
                   sum(case when g.status = Codify.grading.model.GradeStatus.PASS then 1 else 0 end) as passed,
                   sum(case when g.status = Codify.grading.model.GradeStatus.FAIL then 1 else 0 end) as failed,
                   sum(case when g.status = Codify.grading.model.GradeStatus.FLAG then 1 else 0 end) as flagged
            from GradeRecord g
            where (:assignmentCode is null or g.assignmentCode = :assignmentCode)
            """)
    GradeStatsView aggregateStats(@Param("assignmentCode") String assignmentCode);
}

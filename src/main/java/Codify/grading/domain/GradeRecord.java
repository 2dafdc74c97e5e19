package Codify.grading.domain;

import Codify.grading.model.GradeStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@Table(
        name = "GradeRecord",
        indexes = {
                @Index(name = "idx_grade_student", columnList = "studentId"),
                @Index(name = "idx_grade_assignment", columnList = "assignmentCode")
        }
)
public class GradeRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "gradeRecordId")
    private Long id;

    @Column(name = "studentId", nullable = false)
    private String studentId;

    @Column(name = "studentName", nullable = false)
    private String studentName;

    @Column(name = "assignmentCode")
    private String assignmentCode;

    @Column(name = "filename", nullable = false)
    private String filename;

    // 기준이 없으면 점수 없음
    @Column(name = "totalScore")
    private Integer totalScore;

    @Column(name = "logicScore")
    private Integer logicScore;

    @Column(name = "algorithmScore")
    private Integer algorithmScore;

    @Column(name = "styleScore")
    private Integer styleScore;

    @Column(name = "optimizationScore")
    private Integer optimizationScore;

    @Column(name = "algorithms")
    private String algorithms;

    @Column(name = "complexity")
    private int complexity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GradeStatus status;

    @Column(name = "reasoning", columnDefinition = "TEXT")
    private String reasoning;

    @Column(name = "improvement", columnDefinition = "TEXT")
    private String improvement;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "aiScored")
    private boolean aiScored;

    @Column(name = "runtimeMillis")
    private long runtimeMillis;

    @Column(name = "submittedAt", nullable = false)
    private LocalDateTime submittedAt;
}

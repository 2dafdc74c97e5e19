package Codify.grading.web.controller;

import Codify.grading.service.GradeQueryService;
import Codify.grading.web.dto.AssignmentScoresResponseDto;
import Codify.grading.web.dto.GradeStatsResponseDto;
import Codify.grading.web.dto.StudentScoresResponseDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Scores")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/grading")
public class ScoreController {

    private final GradeQueryService gradeQueryService;

    @Operation(operationId = "getStudentScores", summary = "학생별 채점 이력 조회")
    @GetMapping("/scores/student/{studentId}")
    public ResponseEntity<StudentScoresResponseDto> studentScores(@PathVariable final String studentId) {
        return ResponseEntity.ok(gradeQueryService.studentScores(studentId));
    }

    @Operation(operationId = "getAssignmentScores", summary = "과제별 점수표 조회")
    @GetMapping("/scores/assignment/{assignmentCode}")
    public ResponseEntity<AssignmentScoresResponseDto> assignmentScores(@PathVariable final String assignmentCode) {
        return ResponseEntity.ok(gradeQueryService.assignmentScores(assignmentCode));
    }

    @Operation(
            operationId = "getGradeStats",
            summary = "점수 분포 통계",
            description = """
                    assignment_code를 생략하면 전체 기록 기준으로 집계합니다.
                    - 평균/최고/최저는 점수가 있는 기록만 사용합니다.
                    """
    )
    @GetMapping("/stats")
    public ResponseEntity<GradeStatsResponseDto> stats(
            @RequestParam(name = "assignment_code", required = false) final String assignmentCode
    ) {
        return ResponseEntity.ok(gradeQueryService.stats(assignmentCode));
    }
}

package Codify.grading.web.controller;

import Codify.grading.model.GradingJob;
import Codify.grading.service.GradingJobService;
import Codify.grading.web.dto.GradingJobRequestDto;
import Codify.grading.web.dto.GradingStartResponseDto;
import Codify.grading.web.dto.GradingStatusResponseDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Tag(name = "Grading Jobs")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/grading")
public class GradingController {

    private final GradingJobService gradingJobService;

    @Operation(
            operationId = "startGradingJob",
            summary = "채점 job 시작",
            description = """
                    압축 해제된 소스 파일 목록을 받아 백그라운드에서 채점합니다.
                    - 결과는 job 상태 조회 또는 callback_url 웹훅으로 확인합니다.
                    """
    )
    @PostMapping("/jobs")
    public ResponseEntity<GradingStartResponseDto> start(
            @RequestBody @Valid final GradingJobRequestDto requestDto
    ) {
        final GradingJob job = gradingJobService.submit(requestDto.toGradingRequest());
        return ResponseEntity.accepted().body(
                GradingStartResponseDto.accepted(job.getId(), requestDto.units().size(), requestDto.callbackUrl())
        );
    }

    @Operation(operationId = "getGradingJobStatus", summary = "채점 job 상태 조회")
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<GradingStatusResponseDto> status(@PathVariable final UUID jobId) {
        return ResponseEntity.ok(GradingStatusResponseDto.from(gradingJobService.status(jobId)));
    }
}

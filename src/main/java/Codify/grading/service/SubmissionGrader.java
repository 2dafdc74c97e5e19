package Codify.grading.service;

import Codify.grading.client.RubricProvider;
import Codify.grading.config.GradingProperties;
import Codify.grading.model.AnalysisResult;
import Codify.grading.model.GradedResult;
import Codify.grading.model.ProblemRubric;
import Codify.grading.model.ReviewOutcome;
import Codify.grading.model.SourceUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class SubmissionGrader {
    private final CodeAnalysisService analysisService;
    private final RubricProvider rubricProvider;
    private final ReviewService reviewService;
    private final ReviewLimiter reviewLimiter;
    private final Executor analysisExecutor;
    private final int passScoreThreshold;

    public SubmissionGrader(CodeAnalysisService analysisService,
                            RubricProvider rubricProvider,
                            ReviewService reviewService,
                            ReviewLimiter reviewLimiter,
                            @Qualifier("analysisExecutor") Executor analysisExecutor,
                            GradingProperties properties) {
        this.analysisService = analysisService;
        this.rubricProvider = rubricProvider;
        this.reviewService = reviewService;
        this.reviewLimiter = reviewLimiter;
        this.analysisExecutor = analysisExecutor;
        this.passScoreThreshold = properties.getPassScoreThreshold();
    }

    public GradedResult grade(SourceUnit unit, String topic) {
        return reviewLimiter.call(() -> {
            // 트리 순회는 CPU 작업이라 별도 executor에서 실행
            AnalysisResult analysis = CompletableFuture
                    .supplyAsync(() -> analysisService.analyze(unit), analysisExecutor)
                    .join();

            if (!analysis.isValid()) {
                log.warn("Analysis failed for '{}': {}", unit.name(), analysis.getNotes());
                return GradedResult.fromInvalid(analysis);
            }

            Optional<ProblemRubric> rubric = rubricProvider.fetch(rubricKey(unit, topic));
            ReviewOutcome review = reviewService.review(unit.text(), analysis, rubric);
            return GradedResult.merge(analysis, review, passScoreThreshold);
        });
    }

    // 주제가 없으면 파일 이름으로 조회
    private static String rubricKey(SourceUnit unit, String topic) {
        return topic != null && !topic.isBlank() ? topic : unit.name();
    }
}

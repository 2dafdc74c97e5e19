package Codify.grading.service;

import Codify.grading.client.CodeReviewer;
import Codify.grading.exception.reviewexception.ReviewerUnavailableException;
import Codify.grading.model.AnalysisResult;
import Codify.grading.model.ProblemRubric;
import Codify.grading.model.ReviewOutcome;
import Codify.grading.model.ScoreBreakdown;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

// 리뷰어는 최대 한 번 호출, 어떤 실패든 구조 분석 점수로 대체
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    static final String FALLBACK_REASONING =
            "Assessment based on structural code analysis (AST).";
    static final String NO_RUBRIC_REASONING =
            "No problem bank criteria are available. Only the code structure was analyzed; no score was given.";
    static final String NO_RUBRIC_NOTE =
            "Grading criteria have not been configured for this problem.";

    private static final int DEFAULT_FALLBACK_TOTAL = 30;
    private static final Pattern LEADING_FENCE = Pattern.compile("^```(json)?\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final CodeReviewer codeReviewer;
    private final ObjectMapper objectMapper;

    public ReviewOutcome review(String code, AnalysisResult analysis, Optional<ProblemRubric> rubric) {
        if (!codeReviewer.isAvailable()) {
            return fallback(analysis, rubric);
        }

        String raw;
        try {
            raw = codeReviewer.review(buildPrompt(code, analysis, rubric));
        } catch (ReviewerUnavailableException e) {
            log.warn("Review unavailable for '{}', using fallback score: {}", analysis.getName(), e.getMessage());
            return fallback(analysis, rubric);
        } catch (RuntimeException e) {
            // 어떤 리뷰어 오류도 job으로 올리지 않는다
            log.warn("Reviewer failed for '{}', using fallback score", analysis.getName(), e);
            return fallback(analysis, rubric);
        }

        return parse(raw).orElseGet(() -> fallback(analysis, rubric));
    }

    Optional<ReviewOutcome> parse(String raw) {
        JsonNode data;
        try {
            data = objectMapper.readTree(stripFences(raw));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse reviewer JSON: {} | Raw: {}", e.getOriginalMessage(), abbreviate(raw));
            return Optional.empty();
        }
        if (data == null || !data.isObject()) {
            log.warn("Reviewer reply is not a JSON object | Raw: {}", abbreviate(raw));
            return Optional.empty();
        }

        boolean hasRubric = data.path("has_rubric").asBoolean(false);
        JsonNode totalNode = data.path("total_score");

        // 기준이 없거나 점수가 없으면 코멘트만 남긴다
        if (!hasRubric || totalNode.isMissingNode() || totalNode.isNull()) {
            return Optional.of(ReviewOutcome.builder()
                    .hasRubric(false)
                    .detectedAlgorithm(textOrNull(data, "detected_algo"))
                    .strengths(data.path("strengths").asText(""))
                    .weaknesses(data.path("weaknesses").asText(""))
                    .reasoning(data.path("reasoning_feedback").asText("No commentary."))
                    .improvement(data.path("improvement_feedback").asText("No suggestions."))
                    .complexityAnalysis(data.path("complexity_analysis").asText(""))
                    .aiScored(true)
                    .build());
        }

        JsonNode breakdown = data.path("breakdown");
        ScoreBreakdown score = ScoreBreakdown.reviewed(
                totalNode.asInt(0),
                breakdown.path("logic_score").asInt(0),
                breakdown.path("algorithm_score").asInt(0),
                breakdown.path("style_score").asInt(0),
                breakdown.path("optimization_score").asInt(0));

        return Optional.of(ReviewOutcome.builder()
                .totalScore(score.total())
                .breakdown(score)
                .hasRubric(true)
                .detectedAlgorithm(textOrNull(data, "detected_algo"))
                .strengths(data.path("strengths").asText(""))
                .weaknesses(data.path("weaknesses").asText(""))
                .reasoning(data.path("reasoning_feedback").asText(""))
                .improvement(data.path("improvement_feedback").asText(""))
                .complexityAnalysis(data.path("complexity_analysis").asText(""))
                .aiScored(true)
                .build());
    }

    ReviewOutcome fallback(AnalysisResult analysis, Optional<ProblemRubric> rubric) {
        boolean hasRubric = rubric.map(ProblemRubric::hasCriteria).orElse(false);
        if (!hasRubric) {
            return ReviewOutcome.builder()
                    .hasRubric(false)
                    .strengths("")
                    .weaknesses("")
                    .reasoning(NO_RUBRIC_REASONING)
                    .improvement("")
                    .complexityAnalysis("")
                    .notes(List.of(NO_RUBRIC_NOTE))
                    .aiScored(false)
                    .build();
        }

        Optional<ScoreBreakdown> score = analysis.fallbackScore();
        return ReviewOutcome.builder()
                .totalScore(score.map(ScoreBreakdown::total).orElse(DEFAULT_FALLBACK_TOTAL))
                .breakdown(score.orElse(null))
                .hasRubric(true)
                .strengths("")
                .weaknesses("")
                .reasoning(FALLBACK_REASONING)
                .improvement("")
                .complexityAnalysis("")
                .aiScored(false)
                .build();
    }

    String buildPrompt(String code, AnalysisResult analysis, Optional<ProblemRubric> rubric) {
        boolean hasRubric = rubric.map(ProblemRubric::hasCriteria).orElse(false);
        return """
                You are a senior software engineer with ten years of experience reviewing a student's \
                data structures and algorithms submission. Grade it as strictly as a real pull request review.

                YOUR STYLE:
                - Be direct. If the code is bad, say so.
                - Always ask: would you merge this pull request into production code?
                - Working code is not the same as good code.
                - Pay attention to naming, readability, edge cases, Big-O and whether the solution is smart or merely works.

                DEDUCTIONS:
                - Runs but the logic is wrong: -15 to -20.
                - Missing edge cases (empty input, null, negatives, duplicates): -5 to -10 each.
                - Hardcoded results: 0 points.
                - Brute force O(n^2) where O(n log n) or O(n) exists: -15 to -20.
                - Meaningless names such as a, b, x, temp, data1: -3 to -5.
                - No comments or Javadoc: -3.
                - Copy-pasted repetition: -5.
                - Unused imports, dead code, leftover debug prints: -2 to -3.

                SCALE:
                - 90-100: excellent, production quality. Only about 5%% of submissions.
                - 75-89: good idea and fitting algorithm, room for improvement.
                - 60-74: average, works but reads like junior code.
                - 40-59: weak, several logic errors or an unsuitable algorithm.
                - 0-39: failing, fundamentally wrong or hardcoded.

                %s

                AUTOMATED ANALYSIS:
                %s

                SOURCE CODE:
                ```java
                %s
                ```

                REPLY WITH JSON ONLY (no markdown, no extra text):
                {
                  "has_rubric": %s,
                  "total_score": <0-100 when criteria exist, null otherwise>,
                  "breakdown": {
                    "logic_score": <0-40>,
                    "algorithm_score": <0-40>,
                    "style_score": <0-10>,
                    "optimization_score": <0-10>
                  },
                  "detected_algo": "<algorithm name, e.g. Binary Search, BFS, Merge Sort>",
                  "strengths": "<2-3 short points that are actually deserved>",
                  "weaknesses": "<2-4 concrete review comments>",
                  "reasoning_feedback": "<5-7 sentences written like a pull request review>",
                  "improvement_feedback": "<concrete suggestions, most severe first>",
                  "complexity_analysis": "<Time: O(?), Space: O(?) with a short justification>"
                }
                """.formatted(rubricSection(rubric), analysis.getFeatureSummary(), code, hasRubric);
    }

    private static String rubricSection(Optional<ProblemRubric> rubric) {
        ProblemRubric problem = rubric.orElse(null);
        if (problem != null && isPresent(problem.rubric())) {
            return "GRADING CRITERIA (from the problem bank):\n" + problem.rubric();
        }
        if (problem != null && isPresent(problem.requirements())) {
            return "PROBLEM REQUIREMENTS:\n" + problem.requirements() + "\n\n"
                    + "GRADING CRITERIA: no specific rubric in the problem bank.\n"
                    + "Judge logic correctness, algorithm quality, code style and optimization in general.";
        }
        return """
                NOTE: no problem bank criteria are available, so there is NO specific rubric.
                Review the code on:
                - Is the logic correct?
                - Is the algorithm suitable for the problem?
                - Is the code clean and readable?
                - Is it optimized?
                DO NOT give a numeric score. Comment and suggest only.""";
    }

    static String stripFences(String raw) {
        String clean = raw == null ? "" : raw.strip();
        if (clean.startsWith("```")) {
            clean = LEADING_FENCE.matcher(clean).replaceFirst("");
            clean = TRAILING_FENCE.matcher(clean).replaceFirst("");
            clean = clean.strip();
        }
        return clean;
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() <= 200 ? raw : raw.substring(0, 200);
    }
}

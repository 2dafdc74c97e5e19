package Codify.grading.service;

import Codify.grading.core.AlgorithmClassifier;
import Codify.grading.core.FallbackScorer;
import Codify.grading.core.FeatureExtractor;
import Codify.grading.core.FingerprintGenerator;
import Codify.grading.core.JavaSourceParser;
import Codify.grading.core.SafetyScanner;
import Codify.grading.exception.analysisexception.SourceParseException;
import Codify.grading.model.AnalysisResult;
import Codify.grading.model.FeatureRecord;
import Codify.grading.model.GradeStatus;
import Codify.grading.model.GradedResult;
import Codify.grading.model.SourceUnit;
import com.github.javaparser.ast.CompilationUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class CodeAnalysisService {

    static final String SECURITY_VIOLATION = "Security violation";

    public AnalysisResult analyze(SourceUnit unit) {
        long started = System.nanoTime();

        // 1. 구문 분석
        CompilationUnit tree;
        try {
            tree = JavaSourceParser.parse(unit.text());
        } catch (SourceParseException e) {
            log.debug("Syntax error in '{}': {}", unit.name(), e.getMessage());
            return AnalysisResult.invalid(unit.name(), GradeStatus.FAIL, List.of(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Analysis failed for '{}'", unit.name(), e);
            return AnalysisResult.invalid(unit.name(), GradeStatus.FAIL, List.of("Analysis error: " + e.getMessage()));
        }

        // 2. 보안 검사 - 위반이 있으면 특징 추출 없이 바로 FLAG
        List<String> violations = SafetyScanner.scan(tree);
        if (!violations.isEmpty()) {
            List<String> notes = new ArrayList<>();
            notes.add(SECURITY_VIOLATION);
            notes.addAll(violations);
            log.warn("Security violations in '{}': {}", unit.name(), violations);
            return AnalysisResult.invalid(unit.name(), GradeStatus.FLAG, notes);
        }

        // 3. 특징 추출, 4. 알고리즘 분류, 5. 지문, 6. 대체 점수
        FeatureRecord features = FeatureExtractor.extract(tree);
        List<String> algorithms = AlgorithmClassifier.classify(features);

        return AnalysisResult.builder()
                .name(unit.name())
                .valid(true)
                .algorithms(algorithms)
                .complexity(features.cyclomaticComplexity())
                .maxLoopDepth(features.getMaxLoopDepth())
                .fingerprint(FingerprintGenerator.generate(features.getNodeTokens()).orElse(null))
                .fallbackScore(FallbackScorer.score(features, algorithms.size()))
                .featureSummary(summarize(features, algorithms))
                .runtimeMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
                .status(GradeStatus.PENDING)
                .build();
    }

    static String summarize(FeatureRecord features, List<String> algorithms) {
        return "Algorithms: " + GradedResult.labelOf(algorithms)
                + " | Complexity: " + features.cyclomaticComplexity()
                + " | Loops: " + features.getLoopCount()
                + " | Recursion: " + features.isRecursion()
                + " | Classes: " + features.isTypeDefined()
                + " | Functions: " + features.getFunctionCount();
    }
}

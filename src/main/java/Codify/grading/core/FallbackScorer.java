package Codify.grading.core;

import Codify.grading.model.DataStructureKind;
import Codify.grading.model.FeatureRecord;
import Codify.grading.model.PatternHint;
import Codify.grading.model.ScoreBreakdown;

// logic 0-40, algorithm 0-40, style 0-10, optimization 0-10. total은 항상 네 항목의 합
public final class FallbackScorer {
    private FallbackScorer() {}

    static final int MAX_TAG_BONUS = 20;
    static final int MAX_COMPLEXITY_BONUS = 10;

    public static ScoreBreakdown score(FeatureRecord features, int detectedTagCount) {
        int logic = 15;
        if (features.getFunctionCount() > 0) logic += 8;
        if (features.isTypeDefined()) logic += 5;
        if (features.isRecursion()) logic += 6;
        if (features.getLoopCount() > 0) logic += 4;
        if (features.getConditionalCount() > 0) logic += 2;

        int algorithm = 10;
        algorithm += Math.min(detectedTagCount * 8, MAX_TAG_BONUS);
        algorithm += Math.min(features.cyclomaticComplexity() - 1, MAX_COMPLEXITY_BONUS);

        int style = 6;
        if (features.getFunctionCount() >= 2) style += 2;
        if (!features.getDataStructures().isEmpty()) style += 2;

        int optimization = 5;
        if (!features.nestedLoops()) optimization += 2;
        if (features.uses(DataStructureKind.SET) || features.uses(DataStructureKind.MAPPING)) optimization += 2;
        if (features.has(PatternHint.MEMO_TABLE)) optimization += 1;

        return ScoreBreakdown.of(logic, algorithm, style, optimization);
    }
}

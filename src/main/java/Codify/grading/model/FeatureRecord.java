package Codify.grading.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

// nodeTokens는 fingerprint 생성에만 쓰인다
@Value
@Builder
public class FeatureRecord {
    int loopCount;
    int conditionalCount;
    int functionCount;
    int maxLoopDepth;
    boolean recursion;
    boolean typeDefined;
    Set<DataStructureKind> dataStructures;
    Set<PatternHint> hints;
    List<String> functionNames;
    List<String> referencedNames;
    List<String> nodeTokens;

    public boolean nestedLoops() {
        return maxLoopDepth > 1;
    }

    public boolean has(PatternHint hint) {
        return hints.contains(hint);
    }

    public boolean uses(DataStructureKind kind) {
        return dataStructures.contains(kind);
    }

    public int cyclomaticComplexity() {
        return 1 + loopCount + conditionalCount;
    }
}

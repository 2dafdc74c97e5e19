package Codify.grading.core;

import Codify.grading.model.Fingerprint;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class FingerprintGenerator {
    private FingerprintGenerator() {}

    public static final int SHINGLE_SIZE = 3;

    // 토큰이 3개 미만이면 비교할 근거가 부족하므로 지문을 만들지 않는다
    public static Optional<Fingerprint> generate(List<String> nodeTokens) {
        if (nodeTokens.size() < SHINGLE_SIZE) {
            return Optional.empty();
        }
        Set<String> shingles = new HashSet<>();
        for (int i = 0; i + SHINGLE_SIZE <= nodeTokens.size(); i++) {
            shingles.add(String.join("-", nodeTokens.subList(i, i + SHINGLE_SIZE)));
        }
        return Optional.of(new Fingerprint(shingles));
    }
}

package Codify.grading.core;

import Codify.grading.model.Fingerprint;
import Codify.grading.model.SimilarityCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

// 같은 배치 안에서만 비교, 검사 후 fingerprint는 버린다
@Slf4j
public final class SimilarityDetector {
    private SimilarityDetector() {}

    public static <T extends SimilarityCandidate> List<T> detect(List<T> batch, double threshold) {
        if (batch.size() < 2) {
            return batch;
        }

        for (int i = 0; i < batch.size(); i++) {
            Optional<Fingerprint> left = batch.get(i).fingerprint();
            if (left.isEmpty()) continue;

            // i + 1 부터 비교 (중복 제거)
            for (int j = i + 1; j < batch.size(); j++) {
                Optional<Fingerprint> right = batch.get(j).fingerprint();
                if (right.isEmpty()) continue;

                double similarity = left.get().similarity(right.get());
                if (similarity > threshold) {
                    T a = batch.get(i);
                    T b = batch.get(j);
                    long pct = Math.round(similarity * 100);
                    a.flagDuplicate(noteFor(pct, b.getName()));
                    b.flagDuplicate(noteFor(pct, a.getName()));
                    log.warn("Possible duplicate submission: '{}' <-> '{}' ({}%)", a.getName(), b.getName(), pct);
                }
            }
        }

        batch.forEach(SimilarityCandidate::discardFingerprint);
        return batch;
    }

    static String noteFor(long pct, String counterpart) {
        return "WARNING: " + pct + "% structural overlap with submission " + counterpart;
    }
}

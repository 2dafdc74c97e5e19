package Codify.grading.model;

import java.util.Optional;

public interface SimilarityCandidate {
    String getName();

    Optional<Fingerprint> fingerprint();

    void flagDuplicate(String note);

    void discardFingerprint();
}

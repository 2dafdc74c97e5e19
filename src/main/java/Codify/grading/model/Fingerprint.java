package Codify.grading.model;

import Codify.grading.core.JaccardSimilarity;

import java.util.Set;

public record Fingerprint(Set<String> shingles) {

    public Fingerprint {
        shingles = Set.copyOf(shingles);
    }

    public double similarity(Fingerprint other) {
        return JaccardSimilarity.calculate(shingles, other.shingles);
    }

    public int size() {
        return shingles.size();
    }
}

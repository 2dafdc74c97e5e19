package Codify.grading.core;

import java.util.Set;

public final class JaccardSimilarity {
    private JaccardSimilarity() {}

    // |A ∩ B| / |A ∪ B|
    public static double calculate(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;

        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String s : smaller) {
            if (larger.contains(s)) intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }
}

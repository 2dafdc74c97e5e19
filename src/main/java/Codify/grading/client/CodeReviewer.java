package Codify.grading.client;

public interface CodeReviewer {

    // 실패 시 ReviewerUnavailableException
    String review(String prompt);

    default boolean isAvailable() {
        return true;
    }
}

package Codify.grading.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemRubric(String title, String rubric, String requirements) {

    public boolean hasCriteria() {
        return isPresent(rubric) || isPresent(requirements);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}

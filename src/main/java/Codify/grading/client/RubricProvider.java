package Codify.grading.client;

import Codify.grading.model.ProblemRubric;

import java.util.Optional;

// 조회 실패는 예외 대신 empty
public interface RubricProvider {
    Optional<ProblemRubric> fetch(String topicOrName);
}

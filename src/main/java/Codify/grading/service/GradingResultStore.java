package Codify.grading.service;

import Codify.grading.model.GradedResult;

import java.util.List;

public interface GradingResultStore {
    List<Long> saveBatch(List<GradedResult> results, String assignmentCode);
}

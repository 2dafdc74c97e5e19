package Codify.grading.model;

public record SourceUnit(String name, String text) {
}

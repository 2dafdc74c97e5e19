package Codify.grading.model;

public enum DataStructureKind {
    SEQUENCE,
    MAPPING,
    SET,
    PAIR,
    DEQUE
}

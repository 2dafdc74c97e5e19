package Codify.grading.model;

public enum PatternHint {
    SWAP,
    HALVING,
    MEMO_TABLE,
    MATRIX
}

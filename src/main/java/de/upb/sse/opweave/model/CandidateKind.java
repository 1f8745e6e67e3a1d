package de.upb.sse.opweave.model;

public enum CandidateKind {
    INDEX_ACCESS,
    ARITHMETIC_BINARY,
    ASSIGNMENT_BINARY,
    COMPARISON_BINARY,
    UNARY_ARITHMETIC,
    OVERLOADED_OPERATOR_CALL
}

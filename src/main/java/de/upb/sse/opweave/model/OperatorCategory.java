package de.upb.sse.opweave.model;

/**
 * Groups of operators that are switched on and off together by configuration.
 */
public enum OperatorCategory {
    INDEX_ACCESS,
    ARITHMETIC,
    ASSIGNMENT,
    COMPARISON,
    UNARY
}

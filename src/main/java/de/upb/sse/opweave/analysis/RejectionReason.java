package de.upb.sse.opweave.analysis;

/**
 * Why a candidate is left as written.
 */
public enum RejectionReason {
    ADDRESS_OF_OPERAND("operand of an address-of construct"),
    UNEVALUATED_OPERAND("operand of an unevaluated construct"),
    SYSTEM_ORIGIN("located in a system/library region"),
    USER_OVERLOAD("operator is implemented by user code"),
    LVALUE_POSITION("expression is written to"),
    UNADDRESSABLE_TARGET("assignment target is not an array element"),
    CONSTANT_CONTEXT("expression must stay a compile-time constant"),
    VOLATILE_OPERAND("operand is volatile"),
    INCOMPLETE_TYPE("operand type could not be resolved"),
    NON_ARITHMETIC_OPERAND("operand is not of a primitive numeric type"),
    NON_ARRAY_BASE("indexed value is not an array"),
    NARROWING_ASSIGNMENT("assigned value does not widen to the element type"),
    CONST_TARGET("element of a const-qualified array");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

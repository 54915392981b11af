package org.Aayush.tempus.pddl;

/**
 * Distinct failure kinds reported by {@link PddlParser}. Each maps to a stable reason code.
 */
public enum ParseErrorKind {
    SYNTAX("P01_SYNTAX"),
    UNEXPECTED_SECTION("P02_UNEXPECTED_SECTION"),
    UNSUPPORTED_CONSTRUCT("P03_UNSUPPORTED_CONSTRUCT"),
    UNDECLARED_TYPE("P10_UNDECLARED_TYPE"),
    UNDECLARED_PREDICATE("P11_UNDECLARED_PREDICATE"),
    UNDECLARED_FUNCTION("P12_UNDECLARED_FUNCTION"),
    UNDECLARED_OBJECT("P13_UNDECLARED_OBJECT"),
    UNDECLARED_PARAMETER("P14_UNDECLARED_PARAMETER"),
    ARITY_MISMATCH("P20_ARITY_MISMATCH"),
    TYPE_MISMATCH("P21_TYPE_MISMATCH"),
    DUPLICATE_TYPE("P30_DUPLICATE_TYPE"),
    DUPLICATE_PREDICATE("P31_DUPLICATE_PREDICATE"),
    DUPLICATE_FUNCTION("P32_DUPLICATE_FUNCTION"),
    DUPLICATE_ACTION("P33_DUPLICATE_ACTION"),
    DUPLICATE_OBJECT("P34_DUPLICATE_OBJECT"),
    INVALID_DURATION("P40_INVALID_DURATION"),
    INVALID_NUMBER("P41_INVALID_NUMBER"),
    DOMAIN_NAME_MISMATCH("P50_DOMAIN_NAME_MISMATCH");

    private final String reasonCode;

    ParseErrorKind(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}

package com.querysmith.model.filter;

/**
 * Kinds of literal value in an expression.
 */
public enum ValueType {
    /** Plain, language-tagged or typed string. */
    STRING,
    /** Numeric literal written without quotes. */
    NUMBER,
    /** {@code true} or {@code false}. */
    BOOLEAN,
    /** IRI, written in angle brackets. */
    IRI,
    /** {@code xsd:dateTime} literal. */
    DATE_TIME
}

package org.glyphstack.runtime.model;

/**
 * Classifies the recoverable faults ("curses") a running program can trigger.
 * Every kind increments the curse counter by exactly one and substitutes the policy value.
 */
public enum FaultKind {
    /** A pop or peek on a stack that holds no values. */
    EMPTY_STACK,
    /** A dequeue on the empty queue. */
    EMPTY_QUEUE,
    /** A division whose divisor is zero. */
    DIVISION_BY_ZERO,
    /** A bounded-width result that does not fit its representation. */
    OVERFLOW,
    /** A value that cannot be written as a character (negative, fractional or out of Unicode range). */
    INVALID_CODE_POINT,
    /** An input token that is not a number. */
    MALFORMED_INPUT,
    /** Input was requested after the input stream ended. */
    END_OF_INPUT
}

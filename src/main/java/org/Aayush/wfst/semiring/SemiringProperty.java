package org.Aayush.wfst.semiring;

/**
 * Algebraic properties a semiring may declare.
 */
public enum SemiringProperty {
    /** {@code c * (a + b) = c * a + c * b}. */
    LEFT_SEMIRING,
    /** {@code (a + b) * c = a * c + b * c}. */
    RIGHT_SEMIRING,
    /** {@code a * b = b * a}. */
    COMMUTATIVE,
    /** {@code a + a = a}. */
    IDEMPOTENT,
    /** {@code a + b = a or a + b = b}; implies the natural order is total. */
    PATH
}

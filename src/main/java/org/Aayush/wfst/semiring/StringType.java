package org.Aayush.wfst.semiring;

/**
 * Flavour of the string semiring's addition.
 */
public enum StringType {
    /** Addition is only defined for equal arguments; unequal strings signal a non-functional input. */
    RESTRICT,
    /** Addition is the longest common prefix. */
    LEFT,
    /** Addition is the longest common suffix. */
    RIGHT
}

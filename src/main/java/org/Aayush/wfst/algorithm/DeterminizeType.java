package org.Aayush.wfst.algorithm;

/**
 * How output labels are handled when determinizing a transducer. Ignored for acceptors.
 */
public enum DeterminizeType {
    /** Input must be functional; each input string maps to one output string. */
    FUNCTIONAL,
    /** Keeps every output string of an input string. */
    NONFUNCTIONAL,
    /** Keeps only the best output string of each input string; needs a path semiring. */
    DISAMBIGUATE
}

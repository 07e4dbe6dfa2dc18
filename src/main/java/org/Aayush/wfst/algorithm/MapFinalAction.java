package org.Aayush.wfst.algorithm;

/**
 * How {@link ArcMap} treats a mapped final weight whose labels are not epsilon.
 */
public enum MapFinalAction {
    /** Final weights stay final weights; non-epsilon labels are an error. */
    NO_SUPERFINAL,
    /**
     * Non-epsilon results become an arc to a super-final state, created on first need.
     */
    ALLOW_SUPERFINAL,
    /**
     * Every final weight becomes an arc to a super-final state, which is always added to a
     * non-empty automaton.
     */
    REQUIRE_SUPERFINAL
}

package org.Aayush.wfst.algorithm;

/**
 * Direction in which {@link Reweight} and {@link Push} move weight.
 */
public enum ReweightType {
    /** Toward the start state. */
    TO_INITIAL,
    /** Toward the final states. */
    TO_FINAL
}

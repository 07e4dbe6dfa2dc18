package org.Aayush.wfst.semiring;

/**
 * Side from which a divisor is removed.
 */
public enum DivideType {
    /** Left division: finds {@code x} such that {@code b * x = a}. */
    LEFT,
    /** Right division: finds {@code x} such that {@code x * b = a}. */
    RIGHT,
    /** Division where left and right coincide (commutative semirings). */
    ANY
}

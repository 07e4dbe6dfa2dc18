package org.Aayush.wfst.semiring;

/**
 * Flavour of the Gallic semiring's addition.
 */
public enum GallicType {
    /** Restricted string addition: equal strings only. */
    RESTRICT,
    /** Longest common prefix on strings. */
    LEFT,
    /** Longest common suffix on strings. */
    RIGHT,
    /** Keeps the argument with the naturally smaller weight. */
    MIN;

    /**
     * String semiring flavour used for the string component.
     */
    public StringType stringType() {
        switch (this) {
            case LEFT:
                return StringType.LEFT;
            case RIGHT:
                return StringType.RIGHT;
            default:
                return StringType.RESTRICT;
        }
    }
}

package org.Aayush.wfst.fst;

/**
 * Reserved label values.
 */
public final class Labels {
    /** The empty label; consumes or emits nothing. */
    public static final int EPSILON = 0;
    /** Marks an absent label. */
    public static final int NO_LABEL = -1;

    private Labels() {
    }
}

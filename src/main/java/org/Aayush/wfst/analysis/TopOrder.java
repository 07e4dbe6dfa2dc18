package org.Aayush.wfst.analysis;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Topological rank of every state, valid only when {@link #acyclic()} holds.
 */
@Accessors(fluent = true)
public final class TopOrder {
    private final int[] ranks;
    @Getter
    private final boolean acyclic;

    TopOrder(int[] ranks, boolean acyclic) {
        this.ranks = ranks;
        this.acyclic = acyclic;
    }

    public int rank(int state) {
        return ranks[state];
    }

    /**
     * Copy of the rank array indexed by state id.
     */
    public int[] ranks() {
        return ranks.clone();
    }
}

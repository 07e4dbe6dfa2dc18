package org.Aayush.wfst.analysis;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Strongly connected components of an automaton plus per-state reachability.
 *
 * <p>Component ids run over {@code 0..count()-1} in topological order of the component graph:
 * every arc leads to a component with an equal or larger id.</p>
 */
@Accessors(fluent = true)
public final class SccResult {
    private final int[] components;
    private final boolean[] accessible;
    private final boolean[] coaccessible;
    private final boolean[] cyclicComponents;
    @Getter
    private final int count;
    @Getter
    private final boolean initialCyclic;

    SccResult(
            int[] components,
            boolean[] accessible,
            boolean[] coaccessible,
            boolean[] cyclicComponents,
            boolean initialCyclic
    ) {
        this.components = components;
        this.accessible = accessible;
        this.coaccessible = coaccessible;
        this.cyclicComponents = cyclicComponents;
        this.count = cyclicComponents.length;
        this.initialCyclic = initialCyclic;
    }

    public int numStates() {
        return components.length;
    }

    public int component(int state) {
        return components[state];
    }

    /**
     * Copy of the component id of every state.
     */
    public int[] components() {
        return components.clone();
    }

    public boolean isAccessible(int state) {
        return accessible[state];
    }

    public boolean isCoaccessible(int state) {
        return coaccessible[state];
    }

    /**
     * Whether a component holds a cycle (more than one state, or a self-loop).
     */
    public boolean isCyclic(int component) {
        return cyclicComponents[component];
    }

    /**
     * Whether any component holds a cycle.
     */
    public boolean cyclic() {
        for (boolean c : cyclicComponents) {
            if (c) {
                return true;
            }
        }
        return false;
    }

    public boolean allAccessible() {
        for (boolean a : accessible) {
            if (!a) {
                return false;
            }
        }
        return true;
    }

    public boolean allCoaccessible() {
        for (boolean c : coaccessible) {
            if (!c) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of states in one component.
     */
    public int componentSize(int component) {
        int size = 0;
        for (int c : components) {
            if (c == component) {
                size++;
            }
        }
        return size;
    }
}

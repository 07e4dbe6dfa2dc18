package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.semiring.Semiring;

/**
 * Built-in defaults, overridable through JVM system properties.
 */
final class AlgorithmDefaults {
    static final String PROP_DELTA = "wfst.delta";
    static final String PROP_MAX_ITERATIONS = "wfst.shortestdistance.maxIterations";

    /** Iteration ceiling meaning "no ceiling". */
    static final int UNBOUNDED = 0;

    private AlgorithmDefaults() {
    }

    /**
     * Convergence and quantization delta; falls back to {@link Semiring#DEFAULT_DELTA} when the
     * property is absent, unparsable or not positive.
     */
    static float delta() {
        String raw = System.getProperty(PROP_DELTA);
        if (raw == null || raw.isBlank()) {
            return Semiring.DEFAULT_DELTA;
        }
        try {
            float value = Float.parseFloat(raw.trim());
            return value > 0.0f && Float.isFinite(value) ? value : Semiring.DEFAULT_DELTA;
        } catch (NumberFormatException ex) {
            return Semiring.DEFAULT_DELTA;
        }
    }

    /**
     * Relaxation ceiling; values {@code <= 0} or unparsable input mean unbounded.
     */
    static int maxIterations() {
        String raw = System.getProperty(PROP_MAX_ITERATIONS);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Math.max(UNBOUNDED, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }
}

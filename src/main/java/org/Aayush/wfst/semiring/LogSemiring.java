package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Log semiring over negated natural-log probabilities.
 */
public final class LogSemiring extends FloatSemiring<LogWeight> {
    public static final LogSemiring INSTANCE = new LogSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE
    ));

    private LogSemiring() {
    }

    @Override
    LogWeight of(float value) {
        return LogWeight.of(value);
    }

    public LogWeight weight(float value) {
        return LogWeight.of(value);
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public LogWeight plus(LogWeight a, LogWeight b) {
        float x = a.value();
        float y = b.value();
        if (x == Float.POSITIVE_INFINITY) {
            return b;
        }
        if (y == Float.POSITIVE_INFINITY) {
            return a;
        }
        // -log(e^-x + e^-y) = min - log1p(e^-(max - min))
        if (x > y) {
            return LogWeight.of((float) (y - Math.log1p(Math.exp((double) y - x))));
        }
        return LogWeight.of((float) (x - Math.log1p(Math.exp((double) x - y))));
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public LogSemiring reverseSemiring() {
        return this;
    }
}

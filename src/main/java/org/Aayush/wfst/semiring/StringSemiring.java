package org.Aayush.wfst.semiring;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * String semiring {@code (prefix|suffix|restrict, concatenation, Infinity, Epsilon)}.
 */
@Getter
@Accessors(fluent = true)
public final class StringSemiring implements WeaklyDivisibleSemiring<StringWeight> {
    public static final String REASON_NON_FUNCTIONAL = "STRING_RESTRICT_UNEQUAL_ARGUMENTS";

    public static final StringSemiring RESTRICT = new StringSemiring(StringType.RESTRICT);
    public static final StringSemiring LEFT = new StringSemiring(StringType.LEFT);
    public static final StringSemiring RIGHT = new StringSemiring(StringType.RIGHT);

    private final StringType type;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<SemiringProperty> properties;

    private StringSemiring(StringType type) {
        this.type = type;
        EnumSet<SemiringProperty> props = EnumSet.of(SemiringProperty.IDEMPOTENT);
        if (type != StringType.RIGHT) {
            props.add(SemiringProperty.LEFT_SEMIRING);
        }
        if (type != StringType.LEFT) {
            props.add(SemiringProperty.RIGHT_SEMIRING);
        }
        this.properties = Collections.unmodifiableSet(props);
    }

    public static StringSemiring of(StringType type) {
        switch (type) {
            case LEFT:
                return LEFT;
            case RIGHT:
                return RIGHT;
            default:
                return RESTRICT;
        }
    }

    @Override
    public String name() {
        switch (type) {
            case LEFT:
                return "left_string";
            case RIGHT:
                return "right_string";
            default:
                return "restricted_string";
        }
    }

    @Override
    public StringWeight zero() {
        return StringWeight.INFINITY;
    }

    @Override
    public StringWeight one() {
        return StringWeight.EPSILON;
    }

    @Override
    public StringWeight plus(StringWeight a, StringWeight b) {
        if (a.isInfinity()) {
            return b;
        }
        if (b.isInfinity()) {
            return a;
        }
        switch (type) {
            case LEFT:
                return commonPrefix(a, b);
            case RIGHT:
                return commonSuffix(a, b);
            default:
                if (!a.equals(b)) {
                    throw FstException.domain(
                            REASON_NON_FUNCTIONAL,
                            "unequal arguments (non-functional input?): " + a + " vs " + b
                    );
                }
                return a;
        }
    }

    @Override
    public StringWeight times(StringWeight a, StringWeight b) {
        if (a.isInfinity() || b.isInfinity()) {
            return StringWeight.INFINITY;
        }
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        int[] out = Arrays.copyOf(a.labels(), a.size() + b.size());
        for (int i = 0; i < b.size(); i++) {
            out[a.size() + i] = b.label(i);
        }
        return StringWeight.wrap(out);
    }

    @Override
    public StringWeight divide(StringWeight a, StringWeight b, DivideType type) {
        boolean supported = this.type == StringType.RESTRICT
                ? type != DivideType.ANY
                : (this.type == StringType.LEFT ? type == DivideType.LEFT : type == DivideType.RIGHT);
        if (!supported) {
            throw FstException.domain(
                    REASON_UNSUPPORTED_DIVIDE_TYPE,
                    name() + " does not support " + type + " division"
            );
        }
        return type == DivideType.LEFT ? divideLeft(a, b) : divideRight(a, b);
    }

    /**
     * Removes the first {@code b.size()} labels of {@code a}.
     */
    static StringWeight divideLeft(StringWeight a, StringWeight b) {
        if (b.isInfinity()) {
            throw FstException.domain(REASON_DIVIDE_BY_ZERO, "string: division by zero weight");
        }
        if (a.isInfinity()) {
            return StringWeight.INFINITY;
        }
        int[] labels = a.labels();
        return StringWeight.wrap(Arrays.copyOfRange(labels, Math.min(b.size(), labels.length), labels.length));
    }

    /**
     * Removes the last {@code b.size()} labels of {@code a}.
     */
    static StringWeight divideRight(StringWeight a, StringWeight b) {
        if (b.isInfinity()) {
            throw FstException.domain(REASON_DIVIDE_BY_ZERO, "string: division by zero weight");
        }
        if (a.isInfinity()) {
            return StringWeight.INFINITY;
        }
        int[] labels = a.labels();
        return StringWeight.wrap(Arrays.copyOfRange(labels, 0, Math.max(0, labels.length - b.size())));
    }

    @Override
    public Set<SemiringProperty> properties() {
        return properties;
    }

    @Override
    public StringWeight reverse(StringWeight weight) {
        if (weight.isInfinity() || weight.size() < 2) {
            return weight;
        }
        int[] labels = weight.labels();
        int[] out = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            out[i] = labels[labels.length - 1 - i];
        }
        return StringWeight.wrap(out);
    }

    @Override
    public StringSemiring reverseSemiring() {
        switch (type) {
            case LEFT:
                return RIGHT;
            case RIGHT:
                return LEFT;
            default:
                return RESTRICT;
        }
    }

    @Override
    public String toString() {
        return name();
    }

    /**
     * Single-label common divisor used by transducer determinization: the shared first label of
     * both strings, or the empty string.
     */
    public static StringWeight labelCommonDivisor(StringWeight a, StringWeight b) {
        if (a.isInfinity()) {
            return b.isInfinity() || b.isEmpty() ? b : StringWeight.of(b.label(0));
        }
        if (b.isInfinity()) {
            return a.isEmpty() ? a : StringWeight.of(a.label(0));
        }
        if (a.isEmpty() || b.isEmpty() || a.label(0) != b.label(0)) {
            return StringWeight.EPSILON;
        }
        return StringWeight.of(a.label(0));
    }

    private static StringWeight commonPrefix(StringWeight a, StringWeight b) {
        int n = Math.min(a.size(), b.size());
        int i = 0;
        while (i < n && a.label(i) == b.label(i)) {
            i++;
        }
        return i == a.size() ? a : StringWeight.wrap(Arrays.copyOf(a.labels(), i));
    }

    private static StringWeight commonSuffix(StringWeight a, StringWeight b) {
        int n = Math.min(a.size(), b.size());
        int i = 0;
        while (i < n && a.label(a.size() - 1 - i) == b.label(b.size() - 1 - i)) {
            i++;
        }
        int[] labels = a.labels();
        return i == a.size() ? a : StringWeight.wrap(Arrays.copyOfRange(labels, labels.length - i, labels.length));
    }
}

package org.Aayush.wfst.semiring;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Pair of weights from two semirings, combined componentwise.
 *
 * @param <W1> first component type.
 * @param <W2> second component type.
 */
@Value(staticConstructor = "of")
@Accessors(fluent = true)
public class ProductWeight<W1, W2> {
    W1 value1;
    W2 value2;

    @Override
    public String toString() {
        return value1 + "," + value2;
    }
}

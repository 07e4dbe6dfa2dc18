package org.Aayush.wfst.semiring;

/**
 * Semiring whose non-zero elements can be divided.
 *
 * @param <W> weight value type.
 */
public interface WeaklyDivisibleSemiring<W> extends Semiring<W> {

    String REASON_DIVIDE_BY_ZERO = "SEMIRING_DIVIDE_BY_ZERO";
    String REASON_UNSUPPORTED_DIVIDE_TYPE = "SEMIRING_UNSUPPORTED_DIVIDE_TYPE";

    /**
     * Divides {@code a} by {@code b} from the given side.
     *
     * @throws org.Aayush.wfst.FstException with kind {@code DOMAIN_ERROR} when {@code b} is zero
     * or the side is not supported by this family.
     */
    W divide(W a, W b, DivideType type);
}

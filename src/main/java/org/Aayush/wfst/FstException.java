package org.Aayush.wfst;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Contract failure raised by the automaton model, the semiring algebra and the algorithm suite.
 *
 * <p>Every failure carries an {@link ErrorKind} and a deterministic reason code. The message is
 * prefixed with the reason code so logs stay greppable.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FstException extends RuntimeException {

    /**
     * Failure families.
     */
    public enum ErrorKind {
        /** A state id or label is not present. */
        NOT_FOUND,
        /** An arc references a nonexistent state, or decoded data violates format invariants. */
        MALFORMED,
        /** The automaton or semiring lacks a property the operation requires. */
        PRECONDITION_VIOLATED,
        /** An iterative numeric process exceeded its bound. */
        NON_CONVERGENT,
        /** A semiring operation is undefined for its operands. */
        DOMAIN_ERROR
    }

    private final ErrorKind kind;
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param kind failure family.
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public FstException(ErrorKind kind, String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param kind failure family.
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public FstException(ErrorKind kind, String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public static FstException notFound(String reasonCode, String message) {
        return new FstException(ErrorKind.NOT_FOUND, reasonCode, message);
    }

    public static FstException malformed(String reasonCode, String message) {
        return new FstException(ErrorKind.MALFORMED, reasonCode, message);
    }

    public static FstException precondition(String reasonCode, String message) {
        return new FstException(ErrorKind.PRECONDITION_VIOLATED, reasonCode, message);
    }

    public static FstException nonConvergent(String reasonCode, String message) {
        return new FstException(ErrorKind.NON_CONVERGENT, reasonCode, message);
    }

    public static FstException domain(String reasonCode, String message) {
        return new FstException(ErrorKind.DOMAIN_ERROR, reasonCode, message);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

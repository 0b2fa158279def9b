package com.smurthy.ai.search.domain;

/**
 * Unchecked exception carrying one {@link ErrorKind}.
 *
 * Messages read {@code "<sentinel>: <detail>"}. When a failure is wrapped
 * by a higher layer the original exception stays reachable as the cause,
 * and {@link #is(Throwable, ErrorKind)} finds it there.
 */
public class DomainException extends RuntimeException {

    private final ErrorKind kind;

    public DomainException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public DomainException(ErrorKind kind, String detail, Throwable cause) {
        super(format(kind, detail), cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Walks the cause chain looking for a {@code DomainException} of the given kind.
     */
    public static boolean is(Throwable error, ErrorKind kind) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DomainException domain && domain.kind == kind) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Wraps {@code cause} under a new kind while keeping the cause's own message.
     */
    public static DomainException wrap(ErrorKind kind, Throwable cause) {
        return new DomainException(kind, cause.getMessage(), cause);
    }

    private static String format(ErrorKind kind, String detail) {
        if (detail == null || detail.isBlank()) {
            return kind.sentinel();
        }
        return kind.sentinel() + ": " + detail;
    }
}

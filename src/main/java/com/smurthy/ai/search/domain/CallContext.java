package com.smurthy.ai.search.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-call execution context carrying an optional absolute deadline and an
 * optional {@link Cancellation} signal.
 *
 * Every layer that may block (dispatcher, registry, search use case, HTTP
 * client) calls {@link #withDefaultTimeout(Duration)} first, so a deadline
 * set by an outer layer is never extended by an inner one. Derived contexts
 * share the cancellation signal of the context they were derived from.
 */
public final class CallContext {

    private static final CallContext BACKGROUND = new CallContext(null, Clock.systemUTC(), null);

    private final Instant deadline;
    private final Clock clock;
    private final Cancellation cancellation;

    private CallContext(Instant deadline, Clock clock, Cancellation cancellation) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancellation = cancellation;
    }

    /**
     * Context with no deadline that cannot be cancelled.
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    public static CallContext background(Clock clock) {
        return new CallContext(null, clock, null);
    }

    public CallContext withCancellation(Cancellation signal) {
        return new CallContext(deadline, clock, signal);
    }

    public CallContext withTimeout(Duration timeout) {
        Instant candidate = clock.instant().plus(timeout);
        if (deadline != null && deadline.isBefore(candidate)) {
            return this;
        }
        return new CallContext(candidate, clock, cancellation);
    }

    /**
     * Applies {@code timeout} only when no deadline is present yet.
     */
    public CallContext withDefaultTimeout(Duration timeout) {
        if (deadline != null) {
            return this;
        }
        return new CallContext(clock.instant().plus(timeout), clock, cancellation);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Time left before the deadline, never negative. Empty when there is no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }

    /**
     * Runs {@code action} when the call is cancelled. A context without a
     * cancellation signal never runs it.
     */
    public Cancellation.Registration onCancel(Runnable action) {
        return cancellation == null ? Cancellation.Registration.NONE : cancellation.onCancel(action);
    }

    @Override
    public String toString() {
        return "CallContext[deadline=" + (deadline == null ? "none" : deadline) + ", cancelled=" + isCancelled() + "]";
    }
}

package com.social.application.http;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request values threaded from the listener down to the store: the correlation id and
 * the deadline after which in-flight work should be abandoned.
 */
public final class RequestContext {

    private final String requestId;
    private final Instant deadline;
    private final Clock clock;

    private RequestContext(String requestId, Instant deadline, Clock clock) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.deadline = deadline;
        this.clock = clock;
    }

    public static RequestContext start(String requestId, Duration timeout) {
        return start(requestId, timeout, Clock.systemUTC());
    }

    public static RequestContext start(String requestId, Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        return new RequestContext(requestId, clock.instant().plus(timeout), clock);
    }

    /** Context without a deadline. */
    public static RequestContext unbounded(String requestId) {
        return new RequestContext(requestId, null, Clock.systemUTC());
    }

    public String requestId() {
        return requestId;
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left before the deadline, never negative; empty when unbounded. */
    public Optional<Duration> remaining() {
        if (deadline == null) return Optional.empty();
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    @Override
    public String toString() {
        return "RequestContext[requestId=" + requestId + ", deadline=" + deadline + "]";
    }
}

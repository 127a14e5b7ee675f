package io.github.budgetcore;

import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token with an optional deadline.
 * <p>
 * Every blocking entry point of the core accepts one of these. A token is "done" once a stop has been
 * requested on it (or on its parent) or once its deadline has passed. Tokens are cheap; create one per call.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken(null, null);

    private final AtomicBoolean stop = new AtomicBoolean(false);
    private volatile String reason = "";
    private final @Nullable Instant deadline;
    private final @Nullable CancellationToken parent;

    private CancellationToken(@Nullable Instant deadline, @Nullable CancellationToken parent) {
        this.deadline = deadline;
        this.parent = parent;
    }

    /**
     * Creates a fresh token without deadline that is only done when a stop is requested.
     */
    public CancellationToken() {
        this(null, null);
    }

    /**
     * Shared token that never expires and cannot be stopped.
     */
    public static @NotNull CancellationToken none() {
        return NONE;
    }

    public static @NotNull CancellationToken withTimeout(@NotNull Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new CancellationToken(Instant.now().plus(timeout), null);
    }

    public static @NotNull CancellationToken withDeadline(@NotNull Instant deadline) {
        return new CancellationToken(Objects.requireNonNull(deadline, "deadline"), null);
    }

    /**
     * Derives a token that is done when this one is, or when {@code timeout} elapses, whichever comes first.
     */
    public @NotNull CancellationToken child(@NotNull Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant own = Instant.now().plus(timeout);
        Instant effective = (deadline != null && deadline.isBefore(own)) ? deadline : own;
        return new CancellationToken(effective, this == NONE ? null : this);
    }

    /**
     * Derives a token without its own deadline that follows this one.
     */
    public @NotNull CancellationToken child() {
        return new CancellationToken(deadline, this == NONE ? null : this);
    }

    public boolean isStopRequested() {
        if (stop.get()) return true;
        return parent != null && parent.isStopRequested();
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    public boolean isDone() {
        return isStopRequested() || isExpired();
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    public @Nullable Instant deadline() {
        return deadline;
    }

    /**
     * Time left before the deadline; {@code null} when the token has no deadline.
     */
    public @Nullable Duration remaining() {
        if (deadline == null) return null;
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public @NotNull String reason() {
        if (stop.get()) return reason;
        if (parent != null && parent.isStopRequested()) return parent.reason();
        if (isExpired()) return "deadline exceeded";
        return reason;
    }

    public void requestStop(@NotNull String reason) {
        if (this == NONE) return;
        this.reason = reason;
        stop.set(true);
    }

    /**
     * Helper: throws InterruptedException if a stop has been requested.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) throw new InterruptedException("Stop requested: " + reason());
    }

    /**
     * Helper: throws {@link OperationTimedOutException} if the token is stopped or expired.
     */
    public void throwIfDone() throws OperationTimedOutException {
        if (isDone()) throw new OperationTimedOutException(reason());
    }

    @Override
    public String toString() {
        return "CancellationToken{deadline=" + deadline + ", stopped=" + isStopRequested() + '}';
    }
}

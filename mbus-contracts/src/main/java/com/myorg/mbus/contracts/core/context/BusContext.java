package com.myorg.mbus.contracts.core.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token passed through publish and consume calls.
 * <p>
 * A context is done once it is cancelled, its deadline passes, or its parent is done.
 * Children never outlive their parent; cancelling a child does not affect the parent.
 * A finished child is released by its parent, so a long-lived context can hand out
 * any number of short-lived children. Instances are thread-safe.
 */
public final class BusContext {

    public enum DoneReason { CANCELLED, DEADLINE_EXCEEDED }

    private final Clock clock;
    private final Instant deadline;
    private final BusContext parent;
    private final CountDownLatch done = new CountDownLatch(1);
    private final Set<BusContext> children = ConcurrentHashMap.newKeySet();
    private volatile DoneReason reason;

    private BusContext(Clock clock, Instant deadline, BusContext parent) {
        this.clock = clock;
        this.deadline = deadline;
        this.parent = parent;
    }

    /** A fresh root context with no deadline. */
    public static BusContext background() {
        return background(Clock.systemUTC());
    }

    public static BusContext background(Clock clock) {
        return new BusContext(clock, null, null);
    }

    public BusContext withCancel() {
        return child(deadline);
    }

    public BusContext withTimeout(Duration timeout) {
        return withDeadline(clock.instant().plus(timeout));
    }

    public BusContext withDeadline(Instant d) {
        Instant effective = (deadline != null && deadline.isBefore(d)) ? deadline : d;
        return child(effective);
    }

    private BusContext child(Instant childDeadline) {
        // expired children nobody polled are only noticed here
        children.removeIf(BusContext::isDone);
        BusContext c = new BusContext(clock, childDeadline, this);
        children.add(c);
        // parent may have finished before the child was registered
        if (isDone()) {
            c.finish(reason);
        }
        return c;
    }

    public void cancel() {
        finish(DoneReason.CANCELLED);
    }

    public boolean isDone() {
        if (done.getCount() == 0) return true;
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            finish(DoneReason.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /** Null while the context is live. */
    public DoneReason doneReason() {
        return isDone() ? reason : null;
    }

    public void throwIfDone() {
        if (isDone()) {
            throw new ContextDoneException(reason);
        }
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left before the deadline, empty when there is none. Never negative. */
    public Optional<Duration> remaining() {
        if (deadline == null) return Optional.empty();
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Sleeps for {@code d} unless the context finishes first.
     *
     * @return true if the full duration elapsed, false if the context finished (or the thread was interrupted)
     */
    public boolean sleep(Duration d) {
        if (isDone()) return false;
        Duration wait = d;
        boolean capped = false;
        Optional<Duration> left = remaining();
        if (left.isPresent() && left.get().compareTo(wait) < 0) {
            wait = left.get();
            capped = true;
        }
        try {
            if (done.await(wait.toNanos(), TimeUnit.NANOSECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (capped) {
            finish(DoneReason.DEADLINE_EXCEEDED);
            return false;
        }
        return !isDone();
    }

    private void finish(DoneReason r) {
        synchronized (done) {
            if (done.getCount() == 0) return;
            reason = r == null ? DoneReason.CANCELLED : r;
            done.countDown();
        }
        for (BusContext c : children) {
            c.finish(reason);
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    int childCount() {
        return children.size();
    }
}

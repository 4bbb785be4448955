// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import io.cardwire.core.DebugLogger;
import io.cardwire.realtime.transport.TopicKind;
import io.cardwire.realtime.transport.UpstreamHandle;

/**
 * Subscribers of one topic and the single upstream subscription they share.
 *
 * <p>
 * All state is guarded by one lock. No subscriber callback and no transport
 * call is made while it is held: methods that cancel the upstream handle detach
 * it under the lock and cancel it afterwards, and methods that affect
 * subscribers return a snapshot for the caller to notify.
 *
 * <p>
 * Every upstream subscription gets a new generation number when it is opened.
 * Signals carrying an older generation, or arriving after the subscription was
 * detached, are stale.
 *
 * <p>
 * The upstream subscription is opened for one owner. A subscriber registering
 * under a different owner replaces it with a subscription for that owner.
 * Once closed, the registry accepts no subscribers and opens nothing.
 *
 * @param <S> the kind of subscriber
 */
final class TopicRegistry<S extends Subscriber> {

    /**
     * Upstream state of the topic.
     */
    enum State {
        /** No upstream subscription. */
        NO_HANDLE,
        /** Opened or being opened, not yet accepted by the server. */
        PENDING,
        /** Accepted by the server. */
        ACTIVE
    }

    private final TopicKind kind;
    private final SubscriptionMetrics metrics;
    private final Object lock = new Object();

    private final Map<String, S> subscribers = new LinkedHashMap<>();
    private @Nullable UpstreamHandle handle;
    private @Nullable CompletableFuture<Void> inFlightOpen;
    private State state = State.NO_HANDLE;
    private long generation;
    private @Nullable String owner;
    private boolean closed;

    TopicRegistry(final TopicKind kind, final SubscriptionMetrics metrics) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    TopicKind kind() {
        return kind;
    }

    /**
     * Registers a subscriber, replacing any subscriber registered under the same id.
     * Never opens an upstream subscription.
     *
     * @throws IllegalStateException if the registry is closed
     */
    void replaceSubscriber(final String id, final S subscriber) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subscriber, "subscriber");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException(kind + " registry is closed");
            }
            subscribers.put(id, subscriber);
        }
    }

    /**
     * Removes a subscriber. Removing the last subscriber cancels the upstream
     * subscription. Unknown ids are ignored.
     */
    void removeSubscriber(final String id) {
        UpstreamHandle detached = null;
        synchronized (lock) {
            if (subscribers.remove(id) == null) {
                return;
            }
            if (subscribers.isEmpty()) {
                detached = detachLocked();
            }
        }
        cancel(detached);
    }

    /**
     * Removes every subscriber and cancels the upstream subscription.
     *
     * @return the removed subscribers, in registration order
     */
    Map<String, S> removeAllSubscribers() {
        final Map<String, S> removed;
        final UpstreamHandle detached;
        synchronized (lock) {
            removed = snapshotLocked();
            subscribers.clear();
            detached = detachLocked();
        }
        cancel(detached);
        return removed;
    }

    /**
     * Closes the registry: removes every subscriber, cancels the upstream
     * subscription and rejects later registrations. Closing again returns nothing.
     *
     * @return the removed subscribers, in registration order
     */
    Map<String, S> close() {
        final Map<String, S> removed;
        final UpstreamHandle detached;
        synchronized (lock) {
            if (closed) {
                return Map.of();
            }
            closed = true;
            removed = snapshotLocked();
            subscribers.clear();
            detached = detachLocked();
        }
        cancel(detached);
        return removed;
    }

    /**
     * @return a point-in-time copy of the registered subscribers, in registration order
     */
    Map<String, S> currentSubscribers() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    State state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Decides whether the caller must open the upstream subscription for an owner.
     *
     * <p>
     * If no subscription exists and subscribers are registered, the topic moves to
     * {@link State#PENDING} under a new generation and the caller becomes the
     * opener. A subscription held for another owner is cancelled and reopened the
     * same way. If another caller's open call is in flight, the returned ticket
     * waits for it. Otherwise, including after {@link #close()}, there is nothing to do.
     */
    OpenTicket beginOpen(final String requestedOwner) {
        Objects.requireNonNull(requestedOwner, "requestedOwner");
        final OpenTicket ticket;
        UpstreamHandle superseded = null;
        synchronized (lock) {
            if (inFlightOpen != null) {
                return OpenTicket.await(inFlightOpen);
            }
            if (closed || subscribers.isEmpty()) {
                return OpenTicket.none();
            }
            if (state != State.NO_HANDLE) {
                if (requestedOwner.equals(owner)) {
                    return OpenTicket.none();
                }
                DebugLogger.logSubscription("[OWNER-CHANGED] kind=%s generation=%d", kind, generation);
                superseded = detachLocked();
            }
            generation++;
            state = State.PENDING;
            owner = requestedOwner;
            inFlightOpen = new CompletableFuture<>();
            ticket = OpenTicket.open(generation, inFlightOpen);
        }
        cancel(superseded);
        return ticket;
    }

    /**
     * Records the result of an open call. A handle returned for a topic that was
     * emptied, disconnected or reopened meanwhile is cancelled instead of stored.
     * A null handle means the open call failed; the failure signal moves the
     * topic on.
     */
    void completeOpen(final OpenTicket ticket, final @Nullable UpstreamHandle opened) {
        boolean stale = false;
        synchronized (lock) {
            if (inFlightOpen == ticket.future()) {
                inFlightOpen = null;
            }
            if (opened != null) {
                if (ticket.generation() == generation && state != State.NO_HANDLE) {
                    handle = opened;
                } else {
                    stale = true;
                }
            }
        }
        if (stale) {
            DebugLogger.logSubscription("[OPEN-STALE] kind=%s generation=%d", kind, ticket.generation());
            cancel(opened);
        }
        ticket.future().complete(null);
    }

    /**
     * Marks the upstream subscription as accepted.
     *
     * @return the subscribers to notify CONNECTED, empty if already active, or
     *         null if the signal is stale
     */
    @Nullable
    Map<String, S> markEstablished(final long signalGeneration) {
        synchronized (lock) {
            if (!isCurrentLocked(signalGeneration)) {
                return null;
            }
            if (state == State.ACTIVE) {
                return Map.of();
            }
            state = State.ACTIVE;
            return snapshotLocked();
        }
    }

    /**
     * Tears the topic down after its upstream subscription completed or failed:
     * every subscriber is removed and the handle is cancelled if it still runs.
     *
     * @return the removed subscribers to notify DISCONNECTED, or null if the signal is stale
     */
    @Nullable
    Map<String, S> disconnect(final long signalGeneration) {
        final Map<String, S> removed;
        final UpstreamHandle detached;
        synchronized (lock) {
            if (!isCurrentLocked(signalGeneration)) {
                return null;
            }
            removed = snapshotLocked();
            subscribers.clear();
            detached = detachLocked();
        }
        cancel(detached);
        return removed;
    }

    boolean isCurrent(final long signalGeneration) {
        synchronized (lock) {
            return isCurrentLocked(signalGeneration);
        }
    }

    private boolean isCurrentLocked(final long signalGeneration) {
        return state != State.NO_HANDLE && signalGeneration == generation;
    }

    private Map<String, S> snapshotLocked() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(subscribers));
    }

    private @Nullable UpstreamHandle detachLocked() {
        final UpstreamHandle detached = handle;
        handle = null;
        owner = null;
        state = State.NO_HANDLE;
        return detached;
    }

    private void cancel(final @Nullable UpstreamHandle detached) {
        if (detached != null && !detached.isCancelled()) {
            detached.cancel();
            metrics.onUpstreamCancelled(kind);
        }
    }

    /**
     * Outcome of {@link #beginOpen(String)}.
     */
    record OpenTicket(Action action, long generation, CompletableFuture<Void> future) {

        enum Action {
            /** The caller must open the upstream subscription. */
            OPEN,
            /** Another caller is opening; wait for it. */
            AWAIT,
            /** Nothing to do. */
            NONE
        }

        private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

        static OpenTicket open(final long generation, final CompletableFuture<Void> future) {
            return new OpenTicket(Action.OPEN, generation, future);
        }

        static OpenTicket await(final CompletableFuture<Void> future) {
            return new OpenTicket(Action.AWAIT, -1, future);
        }

        static OpenTicket none() {
            return new OpenTicket(Action.NONE, -1, DONE);
        }
    }
}

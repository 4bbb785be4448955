// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.DebugLogger;
import io.cardwire.core.error.AuthenticationException;
import io.cardwire.core.model.FundingSource;
import io.cardwire.core.model.Transaction;
import io.cardwire.core.sealed.Unsealer;
import io.cardwire.realtime.Subscriber.ConnectionState;
import io.cardwire.realtime.TransactionSubscriber.ChangeType;
import io.cardwire.realtime.transport.SubscriptionTransport;
import io.cardwire.realtime.transport.Topic;
import io.cardwire.realtime.transport.TopicKind;

/**
 * Lets any number of consumers observe transaction and funding source changes
 * over a small number of shared upstream subscriptions.
 *
 * <p>
 * Each consumer registers under an id of its choosing. The first subscriber of
 * a stream opens its upstream subscription; later subscribers share it. When the
 * last subscriber leaves, the upstream subscription is cancelled. If the stream
 * completes or fails, every subscriber is told
 * {@link ConnectionState#DISCONNECTED DISCONNECTED} and removed; subscribe again
 * to resume.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (SubscriptionService subscriptions = SubscriptionService.builder()
 *         .transport(GraphQlWebSocketTransport.create(wsConfig))
 *         .identityProvider(session::subject)
 *         .unsealer(deviceKeys)
 *         .build()) {
 *     subscriptions.subscribeToTransactions("ledger-view",
 *             state -> log.info("Transactions {}", state),
 *             (transaction, change) -> ledger.apply(transaction, change));
 *     ...
 * }
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> All methods may be called from any thread.
 * Subscriber callbacks are never made while internal locks are held, so a
 * subscriber may subscribe or unsubscribe from inside a callback.
 *
 * <p>
 * The service does not own the transport: closing the service cancels its
 * upstream subscriptions but leaves the transport open.
 */
public final class SubscriptionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    static final String ERROR_UNAUTHENTICATED_MSG = "User client does not have subject. Is the user authenticated?";
    static final String ERROR_CLOSED_MSG = "SubscriptionService is closed";

    private final IdentityProvider identityProvider;
    private final TopicRegistry<TransactionSubscriber> transactionUpdates;
    private final TopicRegistry<TransactionSubscriber> transactionDeletes;
    private final TopicRegistry<FundingSourceSubscriber> fundingSourceUpdates;
    private final SignalDispatcher dispatcher;
    private final ConnectionCoordinator coordinator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SubscriptionService(final Builder builder) {
        this.identityProvider = Objects.requireNonNull(builder.identityProvider, "identityProvider");
        final SubscriptionTransport transport = Objects.requireNonNull(builder.transport, "transport");
        final Unsealer unsealer = Objects.requireNonNull(builder.unsealer, "unsealer");
        final SubscriptionConfig config = builder.config != null ? builder.config : SubscriptionConfig.defaults();
        final SubscriptionMetrics metrics = builder.metrics != null ? builder.metrics : SubscriptionMetrics.noop();
        final ObjectMapper mapper = new ObjectMapper();

        this.transactionUpdates = new TopicRegistry<>(TopicKind.TRANSACTION_UPDATE, metrics);
        this.transactionDeletes = new TopicRegistry<>(TopicKind.TRANSACTION_DELETE, metrics);
        this.fundingSourceUpdates = new TopicRegistry<>(TopicKind.FUNDING_SOURCE_UPDATE, metrics);

        final TopicLifecycle lifecycle = new TopicLifecycle(metrics);
        lifecycle.register(transactionUpdates,
                new TransactionFanout(mapper, metrics, unsealer, ChangeType.UPSERTED));
        lifecycle.register(transactionDeletes,
                new TransactionFanout(mapper, metrics, unsealer, ChangeType.DELETED));
        lifecycle.register(fundingSourceUpdates, new FundingSourceFanout(mapper, metrics));

        this.dispatcher = SignalDispatcher.create(config, lifecycle::handle, metrics);
        this.coordinator = new ConnectionCoordinator(transport, dispatcher, metrics);
        DebugLogger.log("[SERVICE] created dispatch=%s transport=%s",
                config.dispatchMode(), transport.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes to transaction creations, updates and deletions of the signed-in user.
     *
     * <p>
     * Registering under an id that is already subscribed replaces that
     * subscriber. Returns once the upstream subscriptions have been requested;
     * the subscriber is told {@link ConnectionState#CONNECTED CONNECTED} when the
     * server accepts each of them, or {@link ConnectionState#DISCONNECTED
     * DISCONNECTED} if they fail.
     *
     * @param id         unique id of the subscriber
     * @param subscriber receives transaction changes
     * @throws AuthenticationException if nobody is signed in; nothing is registered
     * @throws IllegalStateException   if the service is closed
     */
    public void subscribeToTransactions(final String id, final TransactionSubscriber subscriber) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subscriber, "subscriber");
        ensureOpen();
        final String owner = requireSubject();

        register(transactionUpdates, id, subscriber);
        register(transactionDeletes, id, subscriber);
        DebugLogger.logSubscription("[SUBSCRIBE] kind=transactions id=%s", id);

        coordinator.ensureConnected(transactionUpdates, new Topic(TopicKind.TRANSACTION_UPDATE, owner));
        coordinator.ensureConnected(transactionDeletes, new Topic(TopicKind.TRANSACTION_DELETE, owner));
    }

    /**
     * Subscribes to transaction changes with callbacks.
     *
     * @param id                  unique id of the subscriber
     * @param onConnectionChange  called when a transaction stream connects or disconnects
     * @param onTransactionChange called with each changed transaction
     * @see #subscribeToTransactions(String, TransactionSubscriber)
     */
    public void subscribeToTransactions(
            final String id,
            final Consumer<ConnectionState> onConnectionChange,
            final BiConsumer<Transaction, ChangeType> onTransactionChange) {
        Objects.requireNonNull(onConnectionChange, "onConnectionChange");
        Objects.requireNonNull(onTransactionChange, "onTransactionChange");
        subscribeToTransactions(id, new TransactionSubscriber() {
            @Override
            public void connectionStatusChanged(final ConnectionState state) {
                onConnectionChange.accept(state);
            }

            @Override
            public void transactionChanged(final Transaction transaction, final ChangeType changeType) {
                onTransactionChange.accept(transaction, changeType);
            }
        });
    }

    /**
     * Subscribes to funding source changes of the signed-in user.
     *
     * @param id         unique id of the subscriber
     * @param subscriber receives funding source changes
     * @throws AuthenticationException if nobody is signed in; nothing is registered
     * @throws IllegalStateException   if the service is closed
     * @see #subscribeToTransactions(String, TransactionSubscriber)
     */
    public void subscribeToFundingSources(final String id, final FundingSourceSubscriber subscriber) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subscriber, "subscriber");
        ensureOpen();
        final String owner = requireSubject();

        register(fundingSourceUpdates, id, subscriber);
        DebugLogger.logSubscription("[SUBSCRIBE] kind=fundingSources id=%s", id);

        coordinator.ensureConnected(fundingSourceUpdates, new Topic(TopicKind.FUNDING_SOURCE_UPDATE, owner));
    }

    /**
     * Subscribes to funding source changes with callbacks.
     *
     * @param id                    unique id of the subscriber
     * @param onConnectionChange    called when the funding source stream connects or disconnects
     * @param onFundingSourceChange called with each changed funding source
     */
    public void subscribeToFundingSources(
            final String id,
            final Consumer<ConnectionState> onConnectionChange,
            final Consumer<FundingSource> onFundingSourceChange) {
        Objects.requireNonNull(onConnectionChange, "onConnectionChange");
        Objects.requireNonNull(onFundingSourceChange, "onFundingSourceChange");
        subscribeToFundingSources(id, new FundingSourceSubscriber() {
            @Override
            public void connectionStatusChanged(final ConnectionState state) {
                onConnectionChange.accept(state);
            }

            @Override
            public void fundingSourceChanged(final FundingSource fundingSource) {
                onFundingSourceChange.accept(fundingSource);
            }
        });
    }

    /**
     * Unsubscribes a transaction subscriber. Unknown ids are ignored. The removed
     * subscriber is not notified.
     */
    public void unsubscribeFromTransactions(final String id) {
        Objects.requireNonNull(id, "id");
        ensureOpen();
        transactionUpdates.removeSubscriber(id);
        transactionDeletes.removeSubscriber(id);
    }

    /**
     * Unsubscribes a funding source subscriber. Unknown ids are ignored. The removed
     * subscriber is not notified.
     */
    public void unsubscribeFromFundingSources(final String id) {
        Objects.requireNonNull(id, "id");
        ensureOpen();
        fundingSourceUpdates.removeSubscriber(id);
    }

    /**
     * Unsubscribes every transaction subscriber and tells each of them DISCONNECTED.
     * The notification is dispatched like stream signals, so it follows any event
     * already on its way to the subscriber.
     */
    public void unsubscribeAllFromTransactions() {
        ensureOpen();
        removeAll(transactionUpdates);
        removeAll(transactionDeletes);
    }

    /**
     * Unsubscribes every funding source subscriber and tells each of them DISCONNECTED.
     * The notification follows any event already on its way to the subscriber.
     */
    public void unsubscribeAllFromFundingSources() {
        ensureOpen();
        removeAll(fundingSourceUpdates);
    }

    /**
     * Unsubscribes every subscriber of every stream.
     */
    public void unsubscribeAll() {
        unsubscribeAllFromTransactions();
        unsubscribeAllFromFundingSources();
    }

    /**
     * Unsubscribes everyone, tells them DISCONNECTED and stops dispatching once the
     * signals already queued have been delivered. A subscribe call running
     * concurrently either completes before the close and is torn down with the
     * rest, or fails with {@link IllegalStateException}. Calling this more than
     * once has no further effect; any other method called afterwards throws
     * {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        publishRemoved(transactionUpdates, transactionUpdates.close());
        publishRemoved(transactionDeletes, transactionDeletes.close());
        publishRemoved(fundingSourceUpdates, fundingSourceUpdates.close());
        dispatcher.close();
        log.debug("Subscription service closed");
    }

    /**
     * @return true once {@link #close()} has been called
     */
    public boolean isClosed() {
        return closed.get();
    }

    private void removeAll(final TopicRegistry<?> registry) {
        publishRemoved(registry, registry.removeAllSubscribers());
    }

    private void publishRemoved(final TopicRegistry<?> registry, final Map<String, ? extends Subscriber> removed) {
        if (!removed.isEmpty()) {
            dispatcher.publish(new TopicSignal.Removed(registry.kind(), removed));
        }
    }

    private String requireSubject() {
        return identityProvider.currentSubject()
                .orElseThrow(() -> new AuthenticationException(ERROR_UNAUTHENTICATED_MSG));
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException(ERROR_CLOSED_MSG);
        }
    }

    /**
     * Registers with a topic. A registry closed after {@link #ensureOpen()} passed
     * means close() ran concurrently.
     */
    private static <S extends Subscriber> void register(
            final TopicRegistry<S> registry, final String id, final S subscriber) {
        try {
            registry.replaceSubscriber(id, subscriber);
        } catch (IllegalStateException e) {
            throw new IllegalStateException(ERROR_CLOSED_MSG, e);
        }
    }

    /**
     * Builder for {@link SubscriptionService}.
     */
    public static final class Builder {
        private @Nullable SubscriptionTransport transport;
        private @Nullable IdentityProvider identityProvider;
        private @Nullable Unsealer unsealer;
        private @Nullable SubscriptionConfig config;
        private @Nullable SubscriptionMetrics metrics;

        private Builder() {
        }

        /**
         * Sets the transport upstream subscriptions are opened on. Required.
         */
        public Builder transport(final SubscriptionTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sets the source of the signed-in user's subject. Required.
         */
        public Builder identityProvider(final IdentityProvider identityProvider) {
            this.identityProvider = identityProvider;
            return this;
        }

        /**
         * Sets the capability that unseals transaction records. Required.
         */
        public Builder unsealer(final Unsealer unsealer) {
            this.unsealer = unsealer;
            return this;
        }

        /**
         * Sets the dispatch configuration. Default: {@link SubscriptionConfig#defaults()}.
         */
        public Builder config(final SubscriptionConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the metrics hook. Default: {@link SubscriptionMetrics#noop()}.
         */
        public Builder metrics(final SubscriptionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws NullPointerException if a required collaborator is missing
         */
        public SubscriptionService build() {
            return new SubscriptionService(this);
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.cardwire.core.model.Transaction;
import io.cardwire.core.sealed.SealedTransaction;
import io.cardwire.core.sealed.TransactionTransformer;
import io.cardwire.core.sealed.Unsealer;
import io.cardwire.realtime.TransactionSubscriber.ChangeType;

/**
 * Unseals transaction events and reports them with the change type of the stream they came from.
 */
final class TransactionFanout extends EventFanout<Transaction, TransactionSubscriber> {

    private final Unsealer unsealer;
    private final ChangeType changeType;

    TransactionFanout(
            final ObjectMapper mapper,
            final SubscriptionMetrics metrics,
            final Unsealer unsealer,
            final ChangeType changeType) {
        super(mapper, metrics);
        this.unsealer = Objects.requireNonNull(unsealer, "unsealer");
        this.changeType = Objects.requireNonNull(changeType, "changeType");
    }

    @Override
    protected Transaction convert(final JsonNode record) throws JsonProcessingException {
        return TransactionTransformer.toEntity(unsealer, mapper.treeToValue(record, SealedTransaction.class));
    }

    @Override
    @SuppressWarnings("deprecation")
    protected void deliver(final TransactionSubscriber subscriber, final Transaction transaction) {
        subscriber.transactionChanged(transaction, changeType);
        if (changeType == ChangeType.UPSERTED) {
            subscriber.transactionChanged(transaction);
        }
    }
}

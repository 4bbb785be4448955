// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.cardwire.core.model.FundingSource;
import io.cardwire.core.model.Transaction;

/**
 * Subscriber of both kinds that records everything it is told, in order.
 */
class RecordingSubscriber implements TransactionSubscriber, FundingSourceSubscriber {

    final List<ConnectionState> states = new CopyOnWriteArrayList<>();
    final List<String> events = new CopyOnWriteArrayList<>();
    final List<String> legacyEvents = new CopyOnWriteArrayList<>();

    @Override
    public void connectionStatusChanged(final ConnectionState state) {
        states.add(state);
    }

    @Override
    public void transactionChanged(final Transaction transaction, final ChangeType changeType) {
        events.add(changeType + ":" + transaction.id());
    }

    @Override
    @SuppressWarnings("deprecation")
    public void transactionChanged(final Transaction transaction) {
        legacyEvents.add(transaction.id());
    }

    @Override
    public void fundingSourceChanged(final FundingSource fundingSource) {
        events.add(fundingSource.id() + "@" + fundingSource.version());
    }
}

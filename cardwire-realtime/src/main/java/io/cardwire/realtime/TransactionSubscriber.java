// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import io.cardwire.core.model.Transaction;

/**
 * Receives transaction changes.
 *
 * <p>
 * A transaction subscriber observes both the update and the delete stream, so
 * it is told about the connection state of each stream separately.
 */
public interface TransactionSubscriber extends Subscriber {

    /**
     * Kind of change a transaction notification reports.
     */
    enum ChangeType {
        /** The transaction was created or updated. */
        UPSERTED,
        /** The transaction was deleted. */
        DELETED
    }

    /**
     * Notifies the subscriber of a created, updated or deleted transaction.
     *
     * @param transaction the changed transaction
     * @param changeType  what happened to it
     */
    default void transactionChanged(final Transaction transaction, final ChangeType changeType) {
    }

    /**
     * Notifies the subscriber of a created or updated transaction. Called after
     * {@link #transactionChanged(Transaction, ChangeType)} for upserts only.
     *
     * @param transaction the changed transaction
     * @deprecated override {@link #transactionChanged(Transaction, ChangeType)} instead
     */
    @Deprecated
    default void transactionChanged(final Transaction transaction) {
    }
}

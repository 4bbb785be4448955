// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

/**
 * Kind of card transaction.
 */
public enum TransactionType {
    /** Transaction is still being processed. */
    PENDING,
    /** Transaction has been completely processed. */
    COMPLETE,
    /** The transaction is a refund. */
    REFUND,
    /** The transaction is the decline of a charge. */
    DECLINE,
    /** Value not known to this client version. */
    UNKNOWN;

    public static TransactionType fromWireName(final String name) {
        for (TransactionType value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}

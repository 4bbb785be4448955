// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

/**
 * The server-pushed change streams a client can observe.
 */
public enum TopicKind {
    /** Funding source created or updated. */
    FUNDING_SOURCE_UPDATE("onFundingSourceUpdate"),
    /** Transaction created or updated. */
    TRANSACTION_UPDATE("onTransactionUpdate"),
    /** Transaction deleted. */
    TRANSACTION_DELETE("onTransactionDelete");

    private final String dataField;

    TopicKind(final String dataField) {
        this.dataField = dataField;
    }

    /**
     * Returns the field of an event's {@code data} object that carries the changed record.
     *
     * @return the data field name
     */
    public String dataField() {
        return dataField;
    }
}

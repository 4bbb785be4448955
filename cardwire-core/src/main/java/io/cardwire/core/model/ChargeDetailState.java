// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

/**
 * State of the funding source charge backing a transaction.
 */
public enum ChargeDetailState {
    /** Funding transaction initiated. */
    PENDING,
    /** Funding transaction cleared. */
    CLEARED,
    /** Funding transaction failed due to insufficient funds. */
    INSUFFICIENT_FUNDS,
    /** Funding transaction failed for another reason. */
    FAILED,
    /** Value not known to this client version. */
    UNKNOWN;

    /**
     * Resolves a wire name, falling back to {@link #UNKNOWN}.
     *
     * @param name the name sent by the service
     * @return the matching state, or {@code UNKNOWN}
     */
    public static ChargeDetailState fromWireName(final String name) {
        for (ChargeDetailState value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}

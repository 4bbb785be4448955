// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

/**
 * Reason a card transaction was declined.
 */
public enum DeclineReason {
    INSUFFICIENT_FUNDS,
    SUSPICIOUS,
    CARD_STOPPED,
    CARD_EXPIRED,
    MERCHANT_BLOCKED,
    MERCHANT_CODE_BLOCKED,
    MERCHANT_COUNTRY_BLOCKED,
    AVS_CHECK_FAILED,
    CSC_CHECK_FAILED,
    EXPIRY_CHECK_FAILED,
    PROCESSING_ERROR,
    DECLINED,
    VELOCITY_EXCEEDED,
    CURRENCY_BLOCKED,
    FUNDING_ERROR,
    INSUFFICIENT_ENTITLEMENTS,
    SERVICE_UNAVAILABLE,
    UNKNOWN;

    /**
     * Resolves a wire name, falling back to {@link #UNKNOWN}.
     *
     * @param name the name sent by the service
     * @return the matching reason, or {@code UNKNOWN}
     */
    public static DeclineReason fromWireName(final String name) {
        for (DeclineReason value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}

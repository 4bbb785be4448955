// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

/**
 * Kind of funding source.
 */
public enum FundingSourceType {
    CREDIT_CARD,
    BANK_ACCOUNT,
    /** Value not known to this client version. */
    UNKNOWN;

    public static FundingSourceType fromWireName(final String name) {
        for (FundingSourceType value : values()) {
            if (value.name().equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}

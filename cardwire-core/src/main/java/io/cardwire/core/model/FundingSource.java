// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A funding source backing the user's virtual cards.
 *
 * <p>
 * Credit card funding sources carry {@code last4} and {@code network}; bank
 * account funding sources carry {@code bankName}. Attributes that do not apply
 * to the funding source's type are null.
 *
 * @param id        identifier of the funding source
 * @param owner     subject of the user that owns the funding source
 * @param version   version assigned by the service
 * @param createdAt when the funding source was created
 * @param updatedAt when the funding source was last updated
 * @param state     current state
 * @param flags     service flags raised on the funding source (for example {@code UNFUNDED})
 * @param type      kind of funding source
 * @param currency  billing currency as an ISO 4217 code
 * @param last4     last four digits of the card, for credit card funding sources
 * @param network   card network, for credit card funding sources
 * @param bankName  institution name, for bank account funding sources
 */
public record FundingSource(
        String id,
        String owner,
        int version,
        Instant createdAt,
        Instant updatedAt,
        State state,
        List<String> flags,
        FundingSourceType type,
        String currency,
        @Nullable String last4,
        @Nullable CreditCardNetwork network,
        @Nullable String bankName) {

    public FundingSource {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(updatedAt, "updatedAt cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(currency, "currency cannot be null");
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    /**
     * Funding source state.
     */
    public enum State {
        /** Funding source is active and can be used. */
        ACTIVE,
        /** Funding source is inactive and cannot be used. */
        INACTIVE,
        /** Funding source needs to be refreshed before it can be used again. */
        REFRESH,
        /** Value not known to this client version. */
        UNKNOWN;

        public static State fromWireName(final String name) {
            for (State value : values()) {
                if (value.name().equals(name)) {
                    return value;
                }
            }
            return UNKNOWN;
        }
    }

    /**
     * Payment network of a credit card funding source.
     */
    public enum CreditCardNetwork {
        AMEX,
        DINERS,
        DISCOVER,
        JCB,
        MASTERCARD,
        UNIONPAY,
        VISA,
        OTHER,
        /** Value not known to this client version. */
        UNKNOWN;

        public static CreditCardNetwork fromWireName(final String name) {
            for (CreditCardNetwork value : values()) {
                if (value.name().equals(name)) {
                    return value;
                }
            }
            return UNKNOWN;
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * How one part of a transaction was charged to a funding source.
 *
 * @param virtualCardAmount   amount charged to the virtual card
 * @param markup              markup applied to the funding source charge
 * @param markupAmount        amount of the markup
 * @param fundingSourceAmount amount charged to the funding source
 * @param fundingSourceId     identifier of the funding source charged
 * @param description         description of the charge
 * @param state               state of the funding source charge
 * @param transactedAt        when the charge was made, if known
 * @param settledAt           when the charge settled, if it has
 */
public record TransactionDetailCharge(
        CurrencyAmount virtualCardAmount,
        Markup markup,
        CurrencyAmount markupAmount,
        CurrencyAmount fundingSourceAmount,
        String fundingSourceId,
        String description,
        ChargeDetailState state,
        @Nullable Instant transactedAt,
        @Nullable Instant settledAt) {

    public TransactionDetailCharge {
        Objects.requireNonNull(virtualCardAmount, "virtualCardAmount cannot be null");
        Objects.requireNonNull(markup, "markup cannot be null");
        Objects.requireNonNull(markupAmount, "markupAmount cannot be null");
        Objects.requireNonNull(fundingSourceAmount, "fundingSourceAmount cannot be null");
        Objects.requireNonNull(fundingSourceId, "fundingSourceId cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
    }
}

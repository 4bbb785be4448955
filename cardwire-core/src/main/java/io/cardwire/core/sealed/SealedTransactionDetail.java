// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

/**
 * One funding source charge of a transaction as sent by the service.
 *
 * <p>
 * {@code fundingSourceId} is plain; every other scalar is sealed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealedTransactionDetail(
        SealedCurrencyAmount virtualCardAmount,
        SealedMarkup markup,
        SealedCurrencyAmount markupAmount,
        SealedCurrencyAmount fundingSourceAmount,
        String fundingSourceId,
        String description,
        @Nullable String state,
        @Nullable String transactedAtEpochMs,
        @Nullable String settledAtEpochMs) {
}

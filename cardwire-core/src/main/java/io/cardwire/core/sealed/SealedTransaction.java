// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

/**
 * Transaction record as pushed by the service.
 *
 * <p>
 * Identifiers, version, type and record timestamps are plain. Amounts,
 * description, decline reason, transaction timestamps and details are sealed
 * with the key named by {@code keyId} and {@code algorithm}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealedTransaction(
        String id,
        String owner,
        int version,
        double createdAtEpochMs,
        double updatedAtEpochMs,
        String algorithm,
        String keyId,
        String cardId,
        String sequenceId,
        String type,
        String transactedAtEpochMs,
        @Nullable String settledAtEpochMs,
        SealedCurrencyAmount billedAmount,
        SealedCurrencyAmount transactedAmount,
        String description,
        @Nullable String declineReason,
        @Nullable List<SealedTransactionDetail> detail) {
}

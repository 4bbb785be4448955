// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A virtual card transaction with all sealed attributes unsealed.
 *
 * @param id               identifier of the transaction
 * @param owner            subject of the user that owns the transaction
 * @param version          current version of the transaction
 * @param createdAt        when the transaction record was created
 * @param updatedAt        when the transaction record was last updated
 * @param transactedAt     when the transaction occurred at the merchant
 * @param settledAt        when the transaction completed, if it has
 * @param cardId           identifier of the virtual card the transaction belongs to
 * @param sequenceId       identifier grouping related transactions
 * @param type             kind of transaction
 * @param billedAmount     amount billed in the card's currency
 * @param transactedAmount amount charged by the merchant
 * @param description      merchant description
 * @param declineReason    why the transaction was declined, or null
 * @param details          how the transaction was charged to funding sources
 */
public record Transaction(
        String id,
        String owner,
        int version,
        Instant createdAt,
        Instant updatedAt,
        Instant transactedAt,
        @Nullable Instant settledAt,
        String cardId,
        String sequenceId,
        TransactionType type,
        CurrencyAmount billedAmount,
        CurrencyAmount transactedAmount,
        String description,
        @Nullable DeclineReason declineReason,
        List<TransactionDetailCharge> details) {

    public Transaction {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(updatedAt, "updatedAt cannot be null");
        Objects.requireNonNull(transactedAt, "transactedAt cannot be null");
        Objects.requireNonNull(cardId, "cardId cannot be null");
        Objects.requireNonNull(sequenceId, "sequenceId cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(billedAmount, "billedAmount cannot be null");
        Objects.requireNonNull(transactedAmount, "transactedAmount cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        details = details == null ? List.of() : List.copyOf(details);
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import java.util.Objects;

import io.cardwire.core.model.FundingSource;
import io.cardwire.core.model.FundingSourceType;

/**
 * Turns funding source update records into {@link FundingSource} entities.
 */
public final class FundingSourceTransformer {

    private FundingSourceTransformer() {
    }

    public static FundingSource toEntity(final FundingSourceUpdate update) {
        Objects.requireNonNull(update, "update");
        final String network = update.network();
        final String type = update.type();
        return new FundingSource(
                update.id(),
                update.owner(),
                update.version(),
                TransactionTransformer.toInstant(update.createdAtEpochMs()),
                TransactionTransformer.toInstant(update.updatedAtEpochMs()),
                FundingSource.State.fromWireName(update.state()),
                update.flags(),
                // Older service versions only had card funding sources and omit the type
                type == null ? FundingSourceType.CREDIT_CARD : FundingSourceType.fromWireName(type),
                update.currency(),
                update.last4(),
                network == null ? null : FundingSource.CreditCardNetwork.fromWireName(network),
                update.bankName());
    }
}

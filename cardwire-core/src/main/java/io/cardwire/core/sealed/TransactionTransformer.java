// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.cardwire.core.error.UnsealException;
import io.cardwire.core.error.UnsealException.UnsupportedDataTypeException;
import io.cardwire.core.model.ChargeDetailState;
import io.cardwire.core.model.CurrencyAmount;
import io.cardwire.core.model.DeclineReason;
import io.cardwire.core.model.Markup;
import io.cardwire.core.model.Transaction;
import io.cardwire.core.model.TransactionDetailCharge;
import io.cardwire.core.model.TransactionType;

/**
 * Turns sealed transaction records into {@link Transaction} entities.
 *
 * <p>
 * Every sealed field is unsealed individually with the record's key. Enum
 * values the client does not know map to their {@code UNKNOWN} constant; a
 * sealed number that does not parse raises
 * {@link UnsupportedDataTypeException}.
 */
public final class TransactionTransformer {

    private TransactionTransformer() {
    }

    /**
     * Unseals a transaction.
     *
     * @param unsealer    unsealing capability holding the device keys
     * @param transaction the sealed record
     * @return the unsealed transaction
     * @throws UnsealException if any field cannot be unsealed
     */
    public static Transaction toEntity(final Unsealer unsealer, final SealedTransaction transaction) {
        Objects.requireNonNull(unsealer, "unsealer");
        Objects.requireNonNull(transaction, "transaction");
        final FieldUnsealer fields = new FieldUnsealer(
                unsealer, new KeyInfo(transaction.keyId(), KeyType.PRIVATE_KEY, transaction.algorithm()));

        final String declineReason = transaction.declineReason();
        final String settledAt = transaction.settledAtEpochMs();
        return new Transaction(
                transaction.id(),
                transaction.owner(),
                transaction.version(),
                toInstant(transaction.createdAtEpochMs()),
                toInstant(transaction.updatedAtEpochMs()),
                fields.unsealInstant(transaction.transactedAtEpochMs()),
                settledAt == null ? null : fields.unsealInstant(settledAt),
                transaction.cardId(),
                transaction.sequenceId(),
                TransactionType.fromWireName(transaction.type()),
                fields.unsealAmount(transaction.billedAmount()),
                fields.unsealAmount(transaction.transactedAmount()),
                fields.unseal(transaction.description()),
                declineReason == null ? null : DeclineReason.fromWireName(fields.unseal(declineReason)),
                toDetails(fields, transaction.detail()));
    }

    private static List<TransactionDetailCharge> toDetails(
            final FieldUnsealer fields, final @Nullable List<SealedTransactionDetail> details) {
        if (details == null || details.isEmpty()) {
            return List.of();
        }
        final List<TransactionDetailCharge> result = new ArrayList<>(details.size());
        for (SealedTransactionDetail detail : details) {
            result.add(toDetail(fields, detail));
        }
        return result;
    }

    private static TransactionDetailCharge toDetail(final FieldUnsealer fields, final SealedTransactionDetail detail) {
        final SealedMarkup markup = detail.markup();
        final String minCharge = markup.minCharge();
        final String state = detail.state();
        final String transactedAt = detail.transactedAtEpochMs();
        final String settledAt = detail.settledAtEpochMs();
        return new TransactionDetailCharge(
                fields.unsealAmount(detail.virtualCardAmount()),
                new Markup(
                        fields.unsealInt(markup.percent()),
                        fields.unsealInt(markup.flat()),
                        minCharge == null ? 0 : fields.unsealInt(minCharge)),
                fields.unsealAmount(detail.markupAmount()),
                fields.unsealAmount(detail.fundingSourceAmount()),
                detail.fundingSourceId(),
                fields.unseal(detail.description()),
                // Records sealed before charge states existed were always cleared
                state == null ? ChargeDetailState.CLEARED : ChargeDetailState.fromWireName(fields.unseal(state)),
                transactedAt == null ? null : fields.unsealInstant(transactedAt),
                settledAt == null ? null : fields.unsealInstant(settledAt));
    }

    static Instant toInstant(final double epochMs) {
        return Instant.ofEpochMilli((long) epochMs);
    }

    /**
     * Binds an {@link Unsealer} to one record's key and adds typed conversions.
     */
    private static final class FieldUnsealer {
        private final Unsealer unsealer;
        private final KeyInfo keyInfo;

        FieldUnsealer(final Unsealer unsealer, final KeyInfo keyInfo) {
            this.unsealer = unsealer;
            this.keyInfo = keyInfo;
        }

        String unseal(final String sealedValue) {
            return unsealer.unseal(keyInfo, sealedValue);
        }

        int unsealInt(final String sealedValue) {
            final String value = unseal(sealedValue);
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new UnsupportedDataTypeException("Sealed value is not an integer", e);
            }
        }

        Instant unsealInstant(final String sealedValue) {
            final String value = unseal(sealedValue);
            try {
                return toInstant(Double.parseDouble(value.trim()));
            } catch (NumberFormatException e) {
                throw new UnsupportedDataTypeException("Sealed value is not an epoch timestamp", e);
            }
        }

        CurrencyAmount unsealAmount(final SealedCurrencyAmount amount) {
            return new CurrencyAmount(unseal(amount.currency()), unsealInt(amount.amount()));
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

import java.util.Objects;

/**
 * An amount of money in minor units of a currency.
 *
 * @param currency ISO 4217 currency code
 * @param amount   amount in the currency's minor units (cents for USD)
 */
public record CurrencyAmount(String currency, int amount) {

    public CurrencyAmount {
        Objects.requireNonNull(currency, "currency cannot be null");
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Currency amount as sent by the service, both fields sealed.
 *
 * @param currency sealed ISO 4217 currency code
 * @param amount   sealed amount in minor units
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealedCurrencyAmount(String currency, String amount) {
}

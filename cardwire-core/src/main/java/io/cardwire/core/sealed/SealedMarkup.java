// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

/**
 * Markup as sent by the service, all fields sealed.
 *
 * @param percent   sealed percentage in thousandths of a percent
 * @param flat      sealed flat fee in minor units
 * @param minCharge sealed minimum charge, absent on older records
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealedMarkup(String percent, String flat, @Nullable String minCharge) {
}

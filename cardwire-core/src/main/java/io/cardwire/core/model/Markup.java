// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.model;

/**
 * Markup applied when a funding source is charged for a card transaction.
 *
 * @param percent   percentage markup in thousandths of a percent
 * @param flat      flat fee in minor units
 * @param minCharge minimum charge in minor units, 0 when the service sends none
 */
public record Markup(int percent, int flat, int minCharge) {
}

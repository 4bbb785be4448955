// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

/**
 * Funding source record as pushed by the service's funding source update stream.
 * Funding source attributes are not sealed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FundingSourceUpdate(
        String id,
        String owner,
        int version,
        double createdAtEpochMs,
        double updatedAtEpochMs,
        String state,
        @Nullable List<String> flags,
        @Nullable String type,
        String currency,
        @Nullable String last4,
        @Nullable String network,
        @Nullable String bankName) {
}

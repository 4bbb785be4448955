// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.cardwire.core.error.UnsealException.SealedDataTooShortException;
import io.cardwire.core.sealed.Unsealer;

/**
 * Event payloads as the server pushes them. Sealed values are {@code sealed:<plain>}.
 */
final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Unseals {@code sealed:<plain>} values. */
    static final Unsealer UNSEALER = (keyInfo, sealedValue) -> {
        if (!sealedValue.startsWith("sealed:")) {
            throw new SealedDataTooShortException("Sealed value too short");
        }
        return sealedValue.substring("sealed:".length());
    };

    private Payloads() {
    }

    static JsonNode fundingSource(final String id, final int version) {
        return parse("""
                {"data": {"onFundingSourceUpdate": {
                  "id": "%s", "owner": "user-sub", "version": %d,
                  "createdAtEpochMs": 1600000000000, "updatedAtEpochMs": 1600000000000,
                  "state": "ACTIVE", "flags": [], "type": "CREDIT_CARD", "currency": "USD",
                  "last4": "4242", "network": "VISA"
                }}}
                """.formatted(id, version));
    }

    static JsonNode transactionUpdate(final String id) {
        return transaction("onTransactionUpdate", id, "sealed:Coffee");
    }

    static JsonNode transactionDelete(final String id) {
        return transaction("onTransactionDelete", id, "sealed:Coffee");
    }

    /** A transaction update whose description cannot be unsealed. */
    static JsonNode unsealableTransactionUpdate(final String id) {
        return transaction("onTransactionUpdate", id, "corrupt");
    }

    private static JsonNode transaction(final String field, final String id, final String description) {
        return parse("""
                {"data": {"%s": {
                  "id": "%s", "owner": "user-sub", "version": 1,
                  "createdAtEpochMs": 1600000000000, "updatedAtEpochMs": 1600000000000,
                  "algorithm": "RSAEncryptionOAEPAESCBC", "keyId": "key-1",
                  "cardId": "card-1", "sequenceId": "seq-1", "type": "PENDING",
                  "transactedAtEpochMs": "sealed:1600000000000",
                  "billedAmount": {"currency": "sealed:USD", "amount": "sealed:100"},
                  "transactedAmount": {"currency": "sealed:USD", "amount": "sealed:100"},
                  "description": "%s"
                }}}
                """.formatted(field, id, description));
    }

    static JsonNode parse(final String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import java.util.Objects;

/**
 * Identifies the key and algorithm needed to unseal a record's fields.
 *
 * @param keyId     identifier of the key the record was sealed with
 * @param keyType   kind of key
 * @param algorithm sealing algorithm named by the service
 */
public record KeyInfo(String keyId, KeyType keyType, String algorithm) {

    public KeyInfo {
        Objects.requireNonNull(keyId, "keyId cannot be null");
        Objects.requireNonNull(keyType, "keyType cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

import io.cardwire.core.error.UnsealException;

/**
 * Envelope decryption of sealed field values.
 *
 * <p>
 * A sealed value is a base64 string. For {@link KeyType#PRIVATE_KEY} records its
 * decoded bytes start with the encrypted symmetric key followed by the cipher
 * text. Implementations own the key material; this library never sees it.
 *
 * <p>
 * Implementations must be thread-safe: the real-time path calls them from the
 * dispatcher thread while the application may call them concurrently.
 */
@FunctionalInterface
public interface Unsealer {

    /**
     * Unseals one field value.
     *
     * @param keyInfo     key and algorithm the owning record was sealed with
     * @param sealedValue base64 encoded sealed value
     * @return the plain text value
     * @throws UnsealException if the value cannot be unsealed
     */
    String unseal(KeyInfo keyInfo, String sealedValue);
}

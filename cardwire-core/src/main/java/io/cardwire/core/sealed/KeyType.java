// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.sealed;

/**
 * Kind of key a record was sealed with.
 */
public enum KeyType {
    /** Sealed with a per-record symmetric key that is itself encrypted with a public key. */
    PRIVATE_KEY,
    /** Sealed directly with a symmetric key held by the device. */
    SYMMETRIC_KEY
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.error;

/**
 * Thrown when a sealed value cannot be turned back into plain data.
 *
 * <p>
 * Unsealing failures are data-integrity problems with a single record. On the
 * real-time path they cause that one event to be dropped; they never tear down
 * a subscription.
 */
public non-sealed class UnsealException extends CardwireException {

    public UnsealException(final String message) {
        super(message);
    }

    public UnsealException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * The sealed value is shorter than the envelope header it must carry.
     */
    public static final class SealedDataTooShortException extends UnsealException {
        public SealedDataTooShortException(final String message) {
            super(message);
        }
    }

    /**
     * The record was sealed with an algorithm this client does not support.
     */
    public static final class UnsupportedAlgorithmException extends UnsealException {
        public UnsupportedAlgorithmException(final String algorithm) {
            super("Unsupported sealing algorithm: " + algorithm);
        }
    }

    /**
     * An unsealed value could not be converted to the type its field requires.
     */
    public static final class UnsupportedDataTypeException extends UnsealException {
        public UnsupportedDataTypeException(final String message) {
            super(message);
        }

        public UnsupportedDataTypeException(final String message, final Throwable cause) {
            super(message, cause);
        }
    }
}

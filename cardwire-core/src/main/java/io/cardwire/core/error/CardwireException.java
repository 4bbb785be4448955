// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.error;

/**
 * Base runtime exception for all Cardwire failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CardwireException
 * ├── {@link AuthenticationException} - no authenticated subject to scope a subscription
 * ├── {@link TransportException} - streaming connection or protocol failures
 * └── {@link UnsealException} - sealed data could not be unsealed
 *     ├── {@link UnsealException.SealedDataTooShortException}
 *     ├── {@link UnsealException.UnsupportedAlgorithmException}
 *     └── {@link UnsealException.UnsupportedDataTypeException}
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     subscriptions.subscribeToTransactions("ledger-view", subscriber);
 * } catch (AuthenticationException e) {
 *     // Sign the user in, then subscribe again
 * } catch (CardwireException e) {
 *     // Catch-all for any other Cardwire error
 * }
 * }</pre>
 */
public sealed class CardwireException extends RuntimeException
        permits AuthenticationException,
        TransportException,
        UnsealException {

    public CardwireException(final String message) {
        super(message);
    }

    public CardwireException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import io.cardwire.core.model.FundingSource;

/**
 * Receives funding source changes.
 */
public interface FundingSourceSubscriber extends Subscriber {

    /**
     * Notifies the subscriber of a created or updated funding source.
     *
     * @param fundingSource the funding source as it is now
     */
    void fundingSourceChanged(FundingSource fundingSource);
}

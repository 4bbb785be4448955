// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.cardwire.core.model.FundingSource;
import io.cardwire.core.sealed.FundingSourceTransformer;
import io.cardwire.core.sealed.FundingSourceUpdate;

final class FundingSourceFanout extends EventFanout<FundingSource, FundingSourceSubscriber> {

    FundingSourceFanout(final ObjectMapper mapper, final SubscriptionMetrics metrics) {
        super(mapper, metrics);
    }

    @Override
    protected FundingSource convert(final JsonNode record) throws JsonProcessingException {
        return FundingSourceTransformer.toEntity(mapper.treeToValue(record, FundingSourceUpdate.class));
    }

    @Override
    protected void deliver(final FundingSourceSubscriber subscriber, final FundingSource fundingSource) {
        subscriber.fundingSourceChanged(fundingSource);
    }
}

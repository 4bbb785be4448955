// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transport listener that queues what it is told.
 */
final class RecordingListener implements TransportListener {

    final BlockingQueue<String> calls = new LinkedBlockingQueue<>();
    final BlockingQueue<JsonNode> payloads = new LinkedBlockingQueue<>();
    final BlockingQueue<Throwable> failures = new LinkedBlockingQueue<>();

    @Override
    public void onEstablished() {
        calls.add("established");
    }

    @Override
    public void onEvent(final JsonNode payload) {
        payloads.add(payload);
        calls.add("event");
    }

    @Override
    public void onCompleted() {
        calls.add("completed");
    }

    @Override
    public void onFailure(final Throwable cause) {
        failures.add(cause);
        calls.add("failure");
    }

    String next() throws InterruptedException {
        final String call = calls.poll(5, TimeUnit.SECONDS);
        if (call == null) {
            throw new AssertionError("No listener call within 5 seconds");
        }
        return call;
    }
}

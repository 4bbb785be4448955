// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.cardwire.core.error.TransportException;

class GraphQlWsSessionTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> sent = new ArrayList<>();
    private GraphQlWsSession session;

    @BeforeEach
    void setUp() {
        session = new GraphQlWsSession(mapper, sent::add, Map.of("Authorization", "token-1", "host", "api.example.com"));
    }

    // ==================== Outbound frame tests ====================

    @Test
    void initSendsConnectionInit() throws Exception {
        session.init();

        JsonNode frame = lastSent();
        assertEquals("connection_init", frame.get("type").asText());
        assertTrue(frame.get("payload").isObject());
    }

    @Test
    void startCarriesRequestAndAuthorization() throws Exception {
        String id = session.start("subscription { x }", Map.of("owner", "user-sub"), new RecordingListener());

        JsonNode frame = lastSent();
        assertEquals(id, frame.get("id").asText());
        assertEquals("start", frame.get("type").asText());

        JsonNode request = mapper.readTree(frame.path("payload").path("data").asText());
        assertEquals("subscription { x }", request.get("query").asText());
        assertEquals("user-sub", request.path("variables").path("owner").asText());

        JsonNode authorization = frame.path("payload").path("extensions").path("authorization");
        assertEquals("token-1", authorization.get("Authorization").asText());
        assertEquals("api.example.com", authorization.get("host").asText());
        assertEquals(1, session.liveSubscriptions());
    }

    @Test
    void everySubscriptionGetsItsOwnId() {
        String first = session.start("q", Map.of(), new RecordingListener());
        String second = session.start("q", Map.of(), new RecordingListener());

        assertFalse(first.equals(second));
    }

    @Test
    void stopSendsStopOnlyForLiveSubscription() throws Exception {
        String id = session.start("q", Map.of(), new RecordingListener());
        sent.clear();

        session.stop(id);
        session.stop(id);
        session.stop("unknown");

        assertEquals(1, sent.size());
        JsonNode frame = lastSent();
        assertEquals("stop", frame.get("type").asText());
        assertEquals(id, frame.get("id").asText());
        assertEquals(0, session.liveSubscriptions());
    }

    @Test
    void failedWriteDoesNotLeaveSubscriptionLive() {
        GraphQlWsSession broken = new GraphQlWsSession(mapper, text -> {
            throw new TransportException("Not connected");
        }, Map.of());

        assertThrows(TransportException.class, () -> broken.start("q", Map.of(), new RecordingListener()));
        assertEquals(0, broken.liveSubscriptions());
    }

    // ==================== Inbound frame tests ====================

    @Test
    void connectionAckCompletesAcknowledgement() {
        assertFalse(session.acknowledged().isDone());

        session.onFrame("{\"type\":\"connection_ack\"}");

        assertTrue(session.acknowledged().isDone());
        assertFalse(session.acknowledged().isCompletedExceptionally());
    }

    @Test
    void framesReachTheirSubscription() throws Exception {
        RecordingListener listener = new RecordingListener();
        RecordingListener other = new RecordingListener();
        String id = session.start("q", Map.of(), listener);
        session.start("q", Map.of(), other);

        session.onFrame("{\"id\":\"" + id + "\",\"type\":\"start_ack\"}");
        session.onFrame("{\"type\":\"ka\"}");
        session.onFrame("{\"id\":\"" + id + "\",\"type\":\"data\",\"payload\":{\"data\":{\"x\":{\"id\":\"r1\"}}}}");
        session.onFrame("{\"id\":\"" + id + "\",\"type\":\"complete\"}");

        assertEquals("established", listener.next());
        assertEquals("event", listener.next());
        assertEquals("completed", listener.next());
        assertEquals("r1", listener.payloads.take().path("data").path("x").path("id").asText());
        assertTrue(other.calls.isEmpty());
        assertEquals(1, session.liveSubscriptions());
    }

    @Test
    void errorFrameFailsSubscriptionWithServerMessages() throws Exception {
        RecordingListener listener = new RecordingListener();
        String id = session.start("q", Map.of(), listener);

        session.onFrame("""
                {"id": "%s", "type": "error", "payload": [{"message": "Unauthorized"}, {"message": "Denied"}]}
                """.formatted(id));
        session.onFrame("{\"id\":\"" + id + "\",\"type\":\"data\",\"payload\":{}}");

        assertEquals("failure", listener.next());
        TransportException ex = assertInstanceOf(TransportException.class, listener.failures.take());
        assertEquals(id, ex.subscriptionId());
        assertEquals(List.of("Unauthorized", "Denied"), ex.serverErrors());
        assertTrue(ex.isUnauthorized());
        assertTrue(listener.calls.isEmpty());
    }

    @Test
    void framesForUnknownSubscriptionsAreIgnored() {
        RecordingListener listener = new RecordingListener();
        session.start("q", Map.of(), listener);

        session.onFrame("{\"id\":\"nope\",\"type\":\"data\",\"payload\":{}}");
        session.onFrame("{\"id\":\"nope\",\"type\":\"complete\"}");
        session.onFrame("{\"type\":\"something_else\"}");
        session.onFrame("not json");

        assertTrue(listener.calls.isEmpty());
    }

    @Test
    void connectionErrorFailsEverything() throws Exception {
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        session.start("q", Map.of(), first);
        session.start("q", Map.of(), second);

        session.onFrame("{\"type\":\"connection_error\",\"payload\":{\"message\":\"Bad token\"}}");

        assertEquals("failure", first.next());
        assertEquals("failure", second.next());
        TransportException ex = assertInstanceOf(TransportException.class, first.failures.take());
        assertEquals(List.of("Bad token"), ex.serverErrors());
        assertNull(ex.subscriptionId());
        ExecutionException ack = assertThrows(ExecutionException.class, () -> session.acknowledged().get());
        assertInstanceOf(TransportException.class, ack.getCause());
        assertEquals(0, session.liveSubscriptions());
    }

    @Test
    void failAllNotifiesEachSubscriptionOnce() throws Exception {
        RecordingListener listener = new RecordingListener();
        session.start("q", Map.of(), listener);

        session.failAll(new TransportException("Connection lost"));
        session.failAll(new TransportException("Connection lost"));

        assertEquals("failure", listener.next());
        assertTrue(listener.calls.isEmpty());
    }

    private JsonNode lastSent() throws Exception {
        return mapper.readTree(sent.get(sent.size() - 1));
    }
}

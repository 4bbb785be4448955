// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.DebugLogger;
import io.cardwire.core.error.TransportException;

/**
 * Client side of the GraphQL-over-WebSocket subscription protocol for one connection.
 *
 * <p>
 * Holds the listeners of the connection's live subscriptions and maps inbound
 * frames onto them:
 * <ul>
 * <li>{@code connection_ack} completes {@link #acknowledged()}</li>
 * <li>{@code start_ack} becomes {@link TransportListener#onEstablished()}</li>
 * <li>{@code data} becomes {@link TransportListener#onEvent(JsonNode)} with the frame's payload</li>
 * <li>{@code error} and {@code complete} end the subscription</li>
 * <li>{@code connection_error} fails every subscription</li>
 * <li>{@code ka} keep-alives are ignored</li>
 * </ul>
 *
 * <p>
 * The session does no I/O itself: outbound frames go to the writer it is given.
 */
final class GraphQlWsSession {

    private static final Logger log = LoggerFactory.getLogger(GraphQlWsSession.class);

    private final ObjectMapper mapper;
    private final Consumer<String> writer;
    private final Map<String, String> authorization;
    private final Map<String, TransportListener> listeners = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> acknowledged = new CompletableFuture<>();

    GraphQlWsSession(final ObjectMapper mapper, final Consumer<String> writer, final Map<String, String> authorization) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.authorization = Objects.requireNonNull(authorization, "authorization");
    }

    /** Sends {@code connection_init}. */
    void init() {
        final ObjectNode frame = mapper.createObjectNode();
        frame.put("type", "connection_init");
        frame.putObject("payload");
        send(frame);
    }

    /**
     * @return completes when the server acknowledges the connection, fails if the
     *         connection is rejected or lost first
     */
    CompletableFuture<Void> acknowledged() {
        return acknowledged;
    }

    /**
     * Starts a subscription.
     *
     * @return the id allocated to the subscription
     * @throws TransportException if the request cannot be encoded or written
     */
    String start(final String document, final Map<String, Object> variables, final TransportListener listener) {
        final String id = UUID.randomUUID().toString();
        final ObjectNode request = mapper.createObjectNode();
        request.put("query", document);
        request.set("variables", mapper.valueToTree(variables));

        final ObjectNode frame = mapper.createObjectNode();
        frame.put("id", id);
        frame.put("type", "start");
        final ObjectNode payload = frame.putObject("payload");
        try {
            payload.put("data", mapper.writeValueAsString(request));
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to encode subscription request", e);
        }
        payload.putObject("extensions").set("authorization", mapper.valueToTree(authorization));

        listeners.put(id, listener);
        try {
            send(frame);
        } catch (RuntimeException e) {
            listeners.remove(id);
            throw e;
        }
        return id;
    }

    /** Stops a subscription. Ids that are not live are ignored. */
    void stop(final String id) {
        if (listeners.remove(id) == null) {
            return;
        }
        final ObjectNode frame = mapper.createObjectNode();
        frame.put("id", id);
        frame.put("type", "stop");
        send(frame);
    }

    /**
     * Handles one inbound text frame.
     */
    void onFrame(final String text) {
        DebugLogger.logTransport("[WS-RECV] %s", text);
        final JsonNode frame;
        try {
            frame = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable frame: {}", e.getOriginalMessage());
            return;
        }
        final String type = frame.path("type").asText("");
        final String id = frame.path("id").asText(null);

        switch (type) {
            case "connection_ack" -> acknowledged.complete(null);
            case "ka" -> {
                // keep-alive
            }
            case "connection_error" -> failAll(new TransportException(
                    "Connection rejected by server", null, errorMessages(frame.path("payload")), null));
            case "start_ack" -> {
                final TransportListener listener = live(id, type);
                if (listener != null) {
                    listener.onEstablished();
                }
            }
            case "data" -> {
                final TransportListener listener = live(id, type);
                if (listener != null) {
                    listener.onEvent(frame.path("payload"));
                }
            }
            case "error" -> {
                final TransportListener listener = id == null ? null : listeners.remove(id);
                if (listener == null) {
                    log.debug("Ignoring error frame for unknown subscription {}", id);
                    return;
                }
                listener.onFailure(new TransportException(
                        "Subscription rejected by server", id, errorMessages(frame.path("payload")), null));
            }
            case "complete" -> {
                final TransportListener listener = id == null ? null : listeners.remove(id);
                if (listener == null) {
                    log.debug("Ignoring complete frame for unknown subscription {}", id);
                    return;
                }
                listener.onCompleted();
            }
            default -> log.debug("Ignoring frame of type '{}'", type);
        }
    }

    /**
     * Fails every live subscription and a pending acknowledgement. Used when the
     * connection is rejected, lost or closed.
     */
    void failAll(final Throwable cause) {
        acknowledged.completeExceptionally(cause);
        for (String id : List.copyOf(listeners.keySet())) {
            final TransportListener listener = listeners.remove(id);
            if (listener != null) {
                listener.onFailure(cause);
            }
        }
    }

    int liveSubscriptions() {
        return listeners.size();
    }

    private @Nullable TransportListener live(final @Nullable String id, final String type) {
        final TransportListener listener = id == null ? null : listeners.get(id);
        if (listener == null) {
            log.debug("Ignoring {} frame for unknown subscription {}", type, id);
        }
        return listener;
    }

    private void send(final ObjectNode frame) {
        final String text = frame.toString();
        DebugLogger.logTransport("[WS-SEND] %s", text);
        writer.accept(text);
    }

    private static List<String> errorMessages(final JsonNode payload) {
        final List<String> messages = new ArrayList<>();
        final JsonNode errors = payload.has("errors") ? payload.get("errors") : payload;
        if (errors.isArray()) {
            for (JsonNode error : errors) {
                messages.add(error.path("message").asText(error.toString()));
            }
        } else if (errors.has("message")) {
            messages.add(errors.get("message").asText());
        } else if (!errors.isMissingNode() && !errors.isNull()) {
            messages.add(errors.toString());
        }
        return messages;
    }
}

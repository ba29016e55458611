package com.phillippitts.truthtell.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.truthtell.exception.SinkException;
import com.phillippitts.truthtell.service.live.LiveSessionSink;
import com.phillippitts.truthtell.service.live.message.OutboundMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link LiveSessionSink} writing JSON text frames to a WebSocket session.
 *
 * <p>The session is expected to be wrapped in a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator} so that
 * sends from different threads are serialized and a stalled client hits a limit instead of
 * blocking the sender indefinitely.
 */
final class WebSocketSessionSink implements LiveSessionSink {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketSessionSink(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void send(OutboundMessage message) {
        if (!session.isOpen()) {
            throw new SinkException("Connection " + session.getId() + " is closed");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new SinkException("Failed to serialize " + message.type() + " message", e);
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | SessionLimitExceededException e) {
            throw new SinkException("Failed to send " + message.type() + " message: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}

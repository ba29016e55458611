package com.phillippitts.truthtell.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.exception.InvalidRequestException;
import com.phillippitts.truthtell.exception.SinkException;
import com.phillippitts.truthtell.exception.TruthTellException;
import com.phillippitts.truthtell.service.live.LiveSessionManager;
import com.phillippitts.truthtell.service.live.LiveSessionSink;
import com.phillippitts.truthtell.service.live.StartLiveRequest;
import com.phillippitts.truthtell.service.live.message.ErrorMessage;
import com.phillippitts.truthtell.service.live.message.OutboundMessage;
import com.phillippitts.truthtell.service.live.message.StatusMessage;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for live stream transcription ({@code /ws/live}).
 *
 * <p>Inbound control messages are JSON objects. Only {@code {"type": "start_live", "url": ...,
 * "language": ...}} is acted upon; other types are ignored. A second {@code start_live} on the
 * same connection replaces the running session. Closing the connection closes its session.
 *
 * <p>Failures to handle a control message are reported to the client as an {@code error}
 * message; the connection stays open.
 */
@Component
public class LiveStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(LiveStreamWebSocketHandler.class);

    static final String START_LIVE = "start_live";
    static final String CONNECTED = "Connected to transcription service";
    static final String CONTROL_FAILED = "Failed to process message";

    private final Map<String, LiveSessionSink> sinks = new ConcurrentHashMap<>();

    private final LiveSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final LiveStreamProperties properties;

    public LiveStreamWebSocketHandler(LiveSessionManager sessionManager,
                                      ObjectMapper objectMapper,
                                      LiveStreamProperties properties) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session,
                (int) properties.getSendTimeLimit().toMillis(), properties.getSendBufferSizeLimit());
        LiveSessionSink sink = new WebSocketSessionSink(concurrent, objectMapper);
        sinks.put(session.getId(), sink);
        LOG.info("WebSocket connection {} established", session.getId());
        reply(session.getId(), sink, StatusMessage.of(CONNECTED));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        LiveSessionSink sink = sinks.get(connectionId);
        if (sink == null) {
            LOG.debug("Message on unregistered connection {} ignored", connectionId);
            return;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("connectionId", connectionId)) {
            handleControl(connectionId, message.getPayload(), sink);
        } catch (TruthTellException e) {
            LOG.warn("Control message on connection {} failed: {}", connectionId, e.getMessage());
            reply(connectionId, sink, new ErrorMessage(CONTROL_FAILED, e.getMessage()));
        }
    }

    private void handleControl(String connectionId, String payload, LiveSessionSink sink) {
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw new InvalidRequestException("payload", "Malformed JSON message");
        }

        String type = json.optString("type", "");
        if (!START_LIVE.equals(type)) {
            LOG.debug("Ignoring control message of type '{}'", type);
            return;
        }

        String url = json.optString("url", "");
        if (url.isBlank()) {
            throw new InvalidRequestException("url", "url is required");
        }
        String language = json.optString("language", properties.getDefaultLanguage());
        if (language.isBlank()) {
            language = properties.getDefaultLanguage();
        }
        sessionManager.start(connectionId, new StartLiveRequest(url, language), sink);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on connection {}: {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sinks.remove(session.getId());
        sessionManager.close(session.getId());
        LOG.info("WebSocket connection {} closed ({})", session.getId(), status);
    }

    private static void reply(String connectionId, LiveSessionSink sink, OutboundMessage message) {
        try {
            sink.send(message);
        } catch (SinkException e) {
            LOG.warn("Could not reply on connection {}: {}", connectionId, e.getMessage());
        }
    }

    int openConnections() {
        return sinks.size();
    }
}

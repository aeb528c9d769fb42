package com.componenttracker.websocket;

import com.componenttracker.dto.BroadcastEvent;
import com.componenttracker.dto.ConnectionCountEvent;
import com.componenttracker.service.EventBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-to-client event channel at {@code /ws}. Owns the set of open sessions and fans every
 * published event out to all of them on the broadcast executor.
 */
@Component
public class ComponentEventsWebSocketHandler extends TextWebSocketHandler implements EventBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(ComponentEventsWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final TaskExecutor broadcastExecutor;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public ComponentEventsWebSocketHandler(ObjectMapper objectMapper,
                                           @Qualifier("broadcastExecutor") TaskExecutor broadcastExecutor) {
        this.objectMapper = objectMapper;
        this.broadcastExecutor = broadcastExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        logger.info("WebSocket connected: {} ({} open)", session.getId(), sessions.size());
        publish(new ConnectionCountEvent(sessions.size()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        logger.info("WebSocket disconnected: {} ({}) ({} open)", session.getId(), status, sessions.size());
        publish(new ConnectionCountEvent(sessions.size()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // clients only listen; inbound frames are ignored
        logger.debug("Ignoring inbound message from {}", session.getId());
    }

    @Override
    public void publish(BroadcastEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize {} event: {}", event.getType(), e.getMessage());
            return;
        }
        TextMessage message = new TextMessage(json);
        broadcastExecutor.execute(() -> sessions.values().forEach(session -> send(session, message)));
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) {
            sessions.remove(session.getId());
            return;
        }
        try {
            session.sendMessage(message);
        } catch (IOException | RuntimeException e) {
            logger.debug("Dropping WebSocket session {} after send failure: {}", session.getId(), e.getMessage());
            sessions.remove(session.getId());
        }
    }
}

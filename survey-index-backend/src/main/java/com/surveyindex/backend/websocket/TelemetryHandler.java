package com.surveyindex.backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.surveyindex.backend.dto.IndexScores;
import com.surveyindex.backend.error.TelemetryException;
import com.surveyindex.backend.service.IndexEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class TelemetryHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TelemetryHandler.class);

    private final IndexEngine engine;
    private final ObjectMapper mapper;

    // sessionId -> session
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public TelemetryHandler(IndexEngine engine, ObjectMapper mapper) {
        this.engine = engine;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("Telemetry client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(
            WebSocketSession session,
            TextMessage message
    ) throws Exception {

        JsonNode node;
        try {
            node = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(session, "Invalid JSON: " + e.getOriginalMessage());
            return;
        }

        String type = node.path("type").asText("");

        try {
            if ("score".equals(type)) {
                handleScore(session, node);
            } else if ("history".equals(type)) {
                handleHistory(session, node);
            } else if ("reset".equals(type)) {
                handleReset(session);
            } else {
                sendError(session, "Unknown message type: '" + type + "'");
            }
        } catch (TelemetryException e) {
            log.warn("Rejected telemetry on session {}: {}", session.getId(), e.getMessage());
            sendError(session, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Telemetry frame failed on session {}", session.getId(), e);
            sendError(session, "Internal error: " + e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(
            WebSocketSession session,
            CloseStatus status
    ) {
        sessions.remove(session.getId());
        log.info("Telemetry client disconnected: {} ({})", session.getId(), status);
    }

    int openSessions() {
        return sessions.size();
    }

    /* =========================
       SCORE
    ========================= */
    private void handleScore(WebSocketSession session, JsonNode node) throws IOException {
        JsonNode record = node.get("record");
        boolean updateHistory = node.path("updateHistory").asBoolean(true);

        IndexScores scores = engine.score(record, updateHistory);

        ObjectNode reply = mapper.createObjectNode();
        reply.put("type", "scores");
        reply.set("data", mapper.valueToTree(scores));
        reply.set("metadata", record.get("metadata"));
        send(session, reply);
    }

    /* =========================
       HISTORY
    ========================= */
    private void handleHistory(WebSocketSession session, JsonNode node) throws IOException {
        String userId = node.hasNonNull("userId") ? node.get("userId").asText() : null;

        ObjectNode reply = mapper.createObjectNode();
        reply.put("type", "history");
        reply.set("data", mapper.valueToTree(engine.history(userId)));
        send(session, reply);
    }

    /* =========================
       RESET
    ========================= */
    private void handleReset(WebSocketSession session) throws IOException {
        String sessionId = engine.reset();

        ObjectNode reply = mapper.createObjectNode();
        reply.put("type", "reset");
        reply.put("sessionId", sessionId);
        send(session, reply);
    }

    /* =========================
       HELPERS
    ========================= */
    private void sendError(WebSocketSession session, String message) throws IOException {
        ObjectNode reply = mapper.createObjectNode();
        reply.put("type", "error");
        reply.put("message", message);
        send(session, reply);
    }

    private void send(WebSocketSession session, ObjectNode message) throws IOException {
        if (session.isOpen()) {
            session.sendMessage(new TextMessage(message.toString()));
        }
    }
}

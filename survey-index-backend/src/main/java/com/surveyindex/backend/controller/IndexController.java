package com.surveyindex.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.dto.IndexScores;
import com.surveyindex.backend.error.TelemetryException;
import com.surveyindex.backend.error.ValidationException;
import com.surveyindex.backend.service.IndexEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/indices")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    private final IndexEngine engine;

    public IndexController(IndexEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("message", "Index Calculator API is running");
        return body;
    }

    @PostMapping("/calculate")
    public Map<String, Object> calculate(@RequestBody(required = false) JsonNode record) {
        IndexScores scores = engine.score(record, true);

        Map<String, Object> body = success();
        body.put("data", scores);
        body.put("metadata", record.get("metadata"));
        return body;
    }

    @PostMapping("/calculate_batch")
    public Map<String, Object> calculateBatch(@RequestBody(required = false) JsonNode request) {
        if (request == null || !request.hasNonNull("questions")) {
            throw new ValidationException("No questions array provided");
        }
        JsonNode questions = request.get("questions");
        if (!questions.isArray()) {
            throw new ValidationException("questions must be an array");
        }

        List<Map<String, Object>> results = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            JsonNode question = questions.get(i);
            Map<String, Object> result = new LinkedHashMap<>();
            try {
                IndexScores scores = engine.score(question, true);
                result.put("SCI", scores.getSci());
                result.put("UEI", scores.getUei());
                result.put("SEI", scores.getSei());
            } catch (TelemetryException e) {
                log.warn("Error processing question {}: {}", i, e.getMessage());
                result.put("error", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure on question {}", i, e);
                result.put("error", "Internal error: " + e.getMessage());
            }
            result.put("metadata", metadataOf(question));
            results.add(result);
        }

        log.info("Batch calculation completed for {} questions", questions.size());

        Map<String, Object> body = success();
        body.put("data", results);
        return body;
    }

    @PostMapping("/reset")
    public Map<String, Object> reset() {
        String sessionId = engine.reset();

        Map<String, Object> body = success();
        body.put("message", "History reset successfully");
        body.put("sessionId", sessionId);
        return body;
    }

    @GetMapping("/history")
    public Map<String, Object> history() {
        return historyBody(engine.history());
    }

    @GetMapping("/history/{userId}")
    public Map<String, Object> history(@PathVariable String userId) {
        return historyBody(engine.history(userId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = success();
        body.put("data", engine.stats());
        return ResponseEntity.ok(body);
    }

    /* =========================
       HELPERS
    ========================= */
    private static Map<String, Object> historyBody(List<HistoryEntry> history) {
        Map<String, Object> body = success();
        body.put("data", history);
        return body;
    }

    private static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        return body;
    }

    private static JsonNode metadataOf(JsonNode question) {
        if (question != null && question.hasNonNull("metadata")) {
            return question.get("metadata");
        }
        return JsonNodeFactory.instance.objectNode();
    }
}

package com.surveyindex.backend.service;

import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.dto.IndexStats;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public class HistoryStore {

    private final Object lock = new Object();

    private final List<HistoryEntry> entries = new ArrayList<>();

    private String sessionId = newSessionId();

    public void append(HistoryEntry entry) {
        synchronized (lock) {
            entries.add(entry);
        }
    }

    /**
     * Appends {@code entry} and returns the history for {@code userId}
     * including it, without another writer slipping in between.
     */
    public List<HistoryEntry> appendAndQuery(HistoryEntry entry, String userId) {
        synchronized (lock) {
            entries.add(entry);
            return snapshot(userId);
        }
    }

    public List<HistoryEntry> query() {
        return query(null);
    }

    /** Read-only snapshot; a null or blank userId returns every entry. */
    public List<HistoryEntry> query(String userId) {
        synchronized (lock) {
            return snapshot(userId);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public String getSessionId() {
        synchronized (lock) {
            return sessionId;
        }
    }

    /** Counts and session id from the same session. */
    public IndexStats stats() {
        synchronized (lock) {
            Set<String> users = new HashSet<>();
            for (HistoryEntry e : entries) {
                users.add(e.getUserId());
            }
            return new IndexStats(entries.size(), users.size(), sessionId);
        }
    }

    public String reset() {
        synchronized (lock) {
            entries.clear();
            sessionId = newSessionId();
            return sessionId;
        }
    }

    private List<HistoryEntry> snapshot(String userId) {
        if (userId == null || userId.isEmpty()) {
            return List.copyOf(entries);
        }
        List<HistoryEntry> filtered = new ArrayList<>();
        for (HistoryEntry e : entries) {
            if (userId.equals(e.getUserId())) {
                filtered.add(e);
            }
        }
        return List.copyOf(filtered);
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}

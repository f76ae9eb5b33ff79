package com.irondust.seo.admin;

import com.irondust.seo.config.AppProperties;
import com.irondust.seo.model.TerminationReason;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps the most recent finished optimization sessions, newest first.
 */
@Component
public class SessionRegistry {
    public static class SessionInfo {
        public String sessionId;
        public String title;
        public String focusKeyword;
        public Instant startedAt;
        public Instant endedAt;
        public double initialScore;
        public double finalScore;
        public double bestScore;
        public int iterationsUsed;
        public boolean complianceAchieved;
        public TerminationReason terminationReason;
    }

    private final Deque<SessionInfo> sessions = new ConcurrentLinkedDeque<>();
    private final int capacity;

    public SessionRegistry(AppProperties appProperties) {
        this.capacity = Math.max(1, appProperties.getSessionHistorySize());
    }

    public void put(SessionInfo info) {
        if (info == null || info.sessionId == null) return;
        sessions.addFirst(info);
        while (sessions.size() > capacity) {
            sessions.pollLast();
        }
    }

    public SessionInfo get(String sessionId) {
        for (SessionInfo s : sessions) {
            if (s.sessionId.equals(sessionId)) return s;
        }
        return null;
    }

    public List<SessionInfo> recent(int limit) {
        List<SessionInfo> out = new ArrayList<>();
        for (SessionInfo s : sessions) {
            if (out.size() >= limit) break;
            out.add(s);
        }
        return out;
    }
}

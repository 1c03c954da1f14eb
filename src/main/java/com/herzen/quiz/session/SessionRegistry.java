package com.herzen.quiz.session;

import com.herzen.quiz.error.SessionConflictException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel key to session map. Insertion is atomic per key; removal is by identity so a stale
 * reference can never remove a newer session of the same channel.
 */
final class SessionRegistry {
    private final Map<String, QuizSession> sessions = new ConcurrentHashMap<>();

    void register(QuizSession session) {
        String key = session.channelKey();
        QuizSession existing = sessions.putIfAbsent(key, session);
        if (existing == null) {
            return;
        }
        if (existing.isActive() || !sessions.replace(key, existing, session)) {
            throw new SessionConflictException(key);
        }
    }

    Optional<QuizSession> find(String channelKey) {
        return Optional.ofNullable(sessions.get(channelKey));
    }

    boolean remove(QuizSession session) {
        return sessions.remove(session.channelKey(), session);
    }

    List<QuizSession> all() {
        return List.copyOf(sessions.values());
    }

    List<QuizSession> removeInactive() {
        List<QuizSession> removed = sessions.values().stream()
                .filter(s -> !s.isActive())
                .toList();
        removed.forEach(this::remove);
        return removed;
    }
}

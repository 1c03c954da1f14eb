package com.herzen.quiz.session;

import java.util.Set;

public final class SessionEventTypes {
    public static final String SESSION_STARTED = "session_started";
    public static final String QUESTION_PRESENTED = "question_presented";
    public static final String ANSWER_REVEALED = "answer_revealed";
    public static final String SESSION_PAUSED = "session_paused";
    public static final String SESSION_RESUMED = "session_resumed";
    public static final String SESSION_STOPPED = "session_stopped";
    public static final String SESSION_COMPLETED = "session_completed";
    public static final String TIMER_FALLBACK = "timer_fallback";
    public static final String SESSION_FAILED = "session_failed";

    public static final Set<String> SUPPORTED = Set.of(
            SESSION_STARTED,
            QUESTION_PRESENTED,
            ANSWER_REVEALED,
            SESSION_PAUSED,
            SESSION_RESUMED,
            SESSION_STOPPED,
            SESSION_COMPLETED,
            TIMER_FALLBACK,
            SESSION_FAILED
    );

    private SessionEventTypes() {}
}

package com.herzen.quiz.session;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.session.SessionModels.QuestionStep;
import com.herzen.quiz.session.SessionModels.SessionSignal;
import com.herzen.quiz.session.SessionModels.SessionSnapshot;
import com.herzen.quiz.session.SessionModels.SessionState;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * State of one channel's quiz run. Every mutation happens under the instance lock, so readers
 * never see a half-applied change. Invariants: {@code 0 <= cursor <= questions.size()} and
 * {@code paused} implies {@code active}.
 */
final class QuizSession {
    private final String channelKey;
    private final String questionSetName;
    private final List<Question> questions;
    private final QuizSettings settings;
    private final Instant startedAt;

    private final BlockingQueue<SessionSignal> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean driverRunning = new AtomicBoolean();

    private int cursor;
    private boolean active = true;
    private boolean paused;

    QuizSession(String channelKey, String questionSetName, List<Question> questions, QuizSettings settings, Instant startedAt) {
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("A session needs at least one question");
        }
        this.channelKey = channelKey;
        this.questionSetName = questionSetName;
        this.questions = List.copyOf(questions);
        this.settings = settings;
        this.startedAt = startedAt;
    }

    String channelKey() {
        return channelKey;
    }

    QuizSettings settings() {
        return settings;
    }

    synchronized boolean isActive() {
        return active;
    }

    synchronized boolean isPaused() {
        return paused;
    }

    synchronized QuestionStep currentStep() {
        if (!active || cursor >= questions.size()) {
            return null;
        }
        return new QuestionStep(cursor, questions.size(), questions.get(cursor));
    }

    synchronized boolean pause() {
        if (!active || paused) {
            return false;
        }
        paused = true;
        return true;
    }

    synchronized boolean resume() {
        if (!active || !paused) {
            return false;
        }
        paused = false;
        return true;
    }

    synchronized boolean advance() {
        if (!active || cursor + 1 >= questions.size()) {
            return false;
        }
        cursor++;
        return true;
    }

    // null if the session had already ended
    synchronized SessionSnapshot complete() {
        if (!active) {
            return null;
        }
        cursor = questions.size();
        active = false;
        paused = false;
        return snapshot();
    }

    synchronized SessionSnapshot stop() {
        if (!active) {
            return null;
        }
        active = false;
        paused = false;
        return snapshot();
    }

    /**
     * Runs {@code action} while holding the session lock, so no stop can land in between.
     *
     * @return the action's result, or null if the session is no longer active
     */
    synchronized <T> T ifActive(Supplier<T> action) {
        if (!active) {
            return null;
        }
        return action.get();
    }

    synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(channelKey, questionSetName, cursor, questions.size(), active, paused,
                settings, startedAt, state());
    }

    void signal(SessionSignal signal) {
        mailbox.offer(signal);
    }

    BlockingQueue<SessionSignal> mailbox() {
        return mailbox;
    }

    boolean claimDriver() {
        return driverRunning.compareAndSet(false, true);
    }

    void releaseDriver() {
        driverRunning.set(false);
    }

    private SessionState state() {
        if (active) {
            return paused ? SessionState.PAUSED : SessionState.ACTIVE;
        }
        return cursor >= questions.size() ? SessionState.COMPLETED : SessionState.STOPPED;
    }
}

package com.herzen.quiz.session;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class SessionModels {
    public enum SessionState { ACTIVE, PAUSED, COMPLETED, STOPPED }

    public enum PresentationOutcome { STARTED, ALREADY_PRESENTING, NOT_APPLICABLE }

    public record SessionSnapshot(String channelKey,
                                  String questionSetName,
                                  int cursor,
                                  int total,
                                  boolean active,
                                  boolean paused,
                                  QuizSettings settings,
                                  Instant startedAt,
                                  SessionState state) {}

    public record PauseResult(SessionSnapshot session, boolean alreadyPaused) {}

    public record ResumeResult(SessionSnapshot session, boolean notPaused) {}

    public record QuestionStep(int index, int total, Question question) {
        public boolean last() {
            return index + 1 >= total;
        }
    }

    public record FinishedSession(SessionSnapshot snapshot, Instant finishedAt) {}

    public record SessionEvent(String channelKey, String eventType, Instant ts, String payload) {}

    public record ChannelError(String operation, String message, Instant ts) {}

    public record ErrorSummary(String channelKey, int errorCount, List<ChannelError> recentErrors) {}

    public record SessionTiming(Duration settleDelay, Duration cleanupDelay, Duration readinessRetryDelay) {}

    record SessionSignal(Kind kind, int questionIndex) {
        enum Kind { EXPIRED, TIMER_LOST, RESUMED, STOPPED }

        static SessionSignal expired(int index) {
            return new SessionSignal(Kind.EXPIRED, index);
        }

        static SessionSignal timerLost(int index) {
            return new SessionSignal(Kind.TIMER_LOST, index);
        }

        static SessionSignal resumed() {
            return new SessionSignal(Kind.RESUMED, -1);
        }

        static SessionSignal stopped() {
            return new SessionSignal(Kind.STOPPED, -1);
        }
    }
}

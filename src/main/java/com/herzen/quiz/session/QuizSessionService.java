package com.herzen.quiz.session;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.EmptyQuestionListException;
import com.herzen.quiz.error.EmptyQuestionSetException;
import com.herzen.quiz.error.QuestionSetNotFoundException;
import com.herzen.quiz.error.SessionConflictException;
import com.herzen.quiz.error.SessionNotFoundException;
import com.herzen.quiz.error.TimerSubsystemException;
import com.herzen.quiz.presentation.PresentationChannel;
import com.herzen.quiz.presentation.QuestionMessageFormatter;
import com.herzen.quiz.questionset.QuestionSetRepository;
import com.herzen.quiz.repository.SessionEventJdbcRepository;
import com.herzen.quiz.retry.RetryExhaustedException;
import com.herzen.quiz.retry.RetryPolicy;
import com.herzen.quiz.selection.QuestionSelector;
import com.herzen.quiz.session.SessionModels.ChannelError;
import com.herzen.quiz.session.SessionModels.ErrorSummary;
import com.herzen.quiz.session.SessionModels.FinishedSession;
import com.herzen.quiz.session.SessionModels.PauseResult;
import com.herzen.quiz.session.SessionModels.PresentationOutcome;
import com.herzen.quiz.session.SessionModels.ResumeResult;
import com.herzen.quiz.session.SessionModels.SessionEvent;
import com.herzen.quiz.session.SessionModels.SessionSignal;
import com.herzen.quiz.session.SessionModels.SessionSnapshot;
import com.herzen.quiz.session.SessionModels.SessionTiming;
import com.herzen.quiz.settings.QuizSettingsStore;
import com.herzen.quiz.timer.TimerModels.TimerTiming;
import com.herzen.quiz.timer.TimerRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class QuizSessionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuizSessionService.class);

    private final SessionRegistry registry = new SessionRegistry();
    private final Map<String, FinishedSession> lastResults = new ConcurrentHashMap<>();

    private final QuestionSetRepository questionSets;
    private final QuizSettingsStore settingsStore;
    private final QuestionSelector selector;
    private final TimerRegistry timers;
    private final PresentationChannel channel;
    private final QuestionMessageFormatter formatter;
    private final SessionEventJdbcRepository eventRepository;
    private final RetryPolicy retryPolicy;
    private final SessionTiming sessionTiming;
    private final TimerTiming timerTiming;
    private final Executor sessionExecutor;
    private final int errorLogLimit;
    private final int eventLogLimit;
    private final Duration resultRetention;

    public QuizSessionService(QuestionSetRepository questionSets,
                              QuizSettingsStore settingsStore,
                              QuestionSelector selector,
                              TimerRegistry timers,
                              PresentationChannel channel,
                              QuestionMessageFormatter formatter,
                              SessionEventJdbcRepository eventRepository,
                              RetryPolicy retryPolicy,
                              SessionTiming sessionTiming,
                              TimerTiming timerTiming,
                              @Qualifier("sessionExecutor") Executor sessionExecutor,
                              @Value("${quiz.session.error-log-limit:10}") int errorLogLimit,
                              @Value("${quiz.session.event-log-limit:200}") int eventLogLimit,
                              @Value("${quiz.session.sweep-fixed-delay-ms:3600000}") long sweepDelayMs) {
        this.questionSets = questionSets;
        this.settingsStore = settingsStore;
        this.selector = selector;
        this.timers = timers;
        this.channel = channel;
        this.formatter = formatter;
        this.eventRepository = eventRepository;
        this.retryPolicy = retryPolicy;
        this.sessionTiming = sessionTiming;
        this.timerTiming = timerTiming;
        this.sessionExecutor = sessionExecutor;
        this.errorLogLimit = errorLogLimit;
        this.eventLogLimit = eventLogLimit;
        this.resultRetention = Duration.ofMillis(sweepDelayMs);
    }

    public SessionSnapshot startSession(String channelKey, String questionSetName, QuizSettings settings) {
        if (registry.find(channelKey).filter(QuizSession::isActive).isPresent()) {
            throw new SessionConflictException(channelKey);
        }
        List<Question> questions = questionSets.getQuestions(questionSetName)
                .orElseThrow(() -> new QuestionSetNotFoundException(questionSetName));
        QuizSettings effective = settings == null ? settingsStore.current() : settingsStore.validate(settings);

        List<Question> selected;
        try {
            selected = selector.select(questions, effective);
        } catch (EmptyQuestionListException e) {
            throw new EmptyQuestionSetException(questionSetName);
        }
        if (selected.isEmpty()) {
            throw new EmptyQuestionSetException(questionSetName);
        }

        QuizSession session = new QuizSession(channelKey, questionSetName, selected, effective, Instant.now());
        registry.register(session);
        lastResults.remove(channelKey);
        recordEvent(channelKey, SessionEventTypes.SESSION_STARTED,
                "set=" + questionSetName + ",questions=" + selected.size() + ",timer=" + effective.timerDurationSeconds());
        LOGGER.info("Session started for channel {}: '{}' with {} questions, {}s timer, {} order",
                channelKey, questionSetName, selected.size(), effective.timerDurationSeconds(),
                effective.randomOrder() ? "random" : "sequential");
        return session.snapshot();
    }

    public PresentationOutcome presentCurrentQuestion(String channelKey) {
        Optional<QuizSession> found = registry.find(channelKey);
        if (found.isEmpty() || !found.get().isActive() || found.get().isPaused()) {
            return PresentationOutcome.NOT_APPLICABLE;
        }
        QuizSession session = found.get();
        if (!session.claimDriver()) {
            return PresentationOutcome.ALREADY_PRESENTING;
        }
        try {
            sessionExecutor.execute(new SessionDriver(session, this, timers, channel, formatter,
                    retryPolicy, sessionTiming, timerTiming));
        } catch (RejectedExecutionException e) {
            session.releaseDriver();
            throw new TimerSubsystemException("SESSION_DRIVER_REJECTED",
                    "Could not schedule question flow for channel " + channelKey, e);
        }
        return PresentationOutcome.STARTED;
    }

    public PauseResult pauseSession(String channelKey) {
        QuizSession session = activeSession(channelKey);
        if (!session.pause()) {
            if (!session.isActive()) {
                throw new SessionNotFoundException(channelKey);
            }
            return new PauseResult(session.snapshot(), true);
        }
        try {
            if (!timers.pauseTimer(channelKey, session)) {
                LOGGER.debug("No timer to pause for channel {}", channelKey);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to pause timer for channel {}: {}", channelKey, e.getMessage());
            recordError(channelKey, "pause_timer", e);
        }
        recordEvent(channelKey, SessionEventTypes.SESSION_PAUSED, null);
        LOGGER.info("Session paused for channel {}", channelKey);
        return new PauseResult(session.snapshot(), false);
    }

    public ResumeResult resumeSession(String channelKey) {
        QuizSession session = activeSession(channelKey);
        if (!session.resume()) {
            if (!session.isActive()) {
                throw new SessionNotFoundException(channelKey);
            }
            return new ResumeResult(session.snapshot(), true);
        }
        try {
            if (!timers.resumeTimer(channelKey, session)) {
                LOGGER.debug("No timer to resume for channel {}", channelKey);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to resume timer for channel {}: {}", channelKey, e.getMessage());
            recordError(channelKey, "resume_timer", e);
        }
        session.signal(SessionSignal.resumed());
        recordEvent(channelKey, SessionEventTypes.SESSION_RESUMED, null);
        LOGGER.info("Session resumed for channel {}", channelKey);
        return new ResumeResult(session.snapshot(), false);
    }

    public SessionSnapshot stopSession(String channelKey) {
        QuizSession session = activeSession(channelKey);
        SessionSnapshot snapshot = session.stop();
        if (snapshot == null) {
            throw new SessionNotFoundException(channelKey);
        }
        session.signal(SessionSignal.stopped());
        timers.cancelTimer(channelKey, session);
        registry.remove(session);
        lastResults.put(channelKey, new FinishedSession(snapshot, Instant.now()));
        recordEvent(channelKey, SessionEventTypes.SESSION_STOPPED, "cursor=" + snapshot.cursor() + ",total=" + snapshot.total());
        LOGGER.info("Session stopped for channel {} at question {}/{}", channelKey,
                Math.min(snapshot.cursor() + 1, snapshot.total()), snapshot.total());
        return snapshot;
    }

    public Optional<SessionSnapshot> getProgress(String channelKey) {
        return registry.find(channelKey).map(QuizSession::snapshot);
    }

    public Optional<FinishedSession> lastResult(String channelKey) {
        return Optional.ofNullable(lastResults.get(channelKey));
    }

    public List<SessionSnapshot> activeSessions() {
        return registry.all().stream()
                .filter(QuizSession::isActive)
                .map(QuizSession::snapshot)
                .sorted(Comparator.comparing(SessionSnapshot::channelKey))
                .toList();
    }

    public String statusSummary(String channelKey) {
        SessionSnapshot snapshot = getProgress(channelKey).orElseThrow(() -> new SessionNotFoundException(channelKey));
        return formatter.statusSummary(snapshot, Instant.now());
    }

    public ErrorSummary errorSummary(String channelKey) {
        List<ChannelError> errors = eventRepository.loadErrors(channelKey);
        List<ChannelError> recent = errors.subList(Math.max(0, errors.size() - errorLogLimit), errors.size());
        return new ErrorSummary(channelKey, eventRepository.countErrors(channelKey), List.copyOf(recent));
    }

    public List<SessionEvent> events(String channelKey) {
        return eventRepository.loadEvents(channelKey);
    }

    @Scheduled(fixedDelayString = "${quiz.session.sweep-fixed-delay-ms:3600000}",
            initialDelayString = "${quiz.session.sweep-fixed-delay-ms:3600000}")
    public void scheduledSweep() {
        sweep();
    }

    public int sweep() {
        List<QuizSession> removed = registry.removeInactive();
        for (QuizSession session : removed) {
            timers.cancelTimer(session.channelKey(), session);
            LOGGER.warn("Removed lingering inactive session for channel {}", session.channelKey());
        }

        int trimmedErrors = 0;
        int trimmedEvents = 0;
        try {
            trimmedErrors = eventRepository.trimErrors(errorLogLimit);
            trimmedEvents = eventRepository.trimEvents(eventLogLimit);
        } catch (DataAccessException e) {
            LOGGER.warn("Could not trim channel logs: {}", e.getMessage());
        }

        Instant cutoff = Instant.now().minus(resultRetention);
        List<String> expired = lastResults.entrySet().stream()
                .filter(entry -> entry.getValue().finishedAt().isBefore(cutoff))
                .map(Map.Entry::getKey)
                .toList();
        for (String channelKey : expired) {
            lastResults.remove(channelKey);
            if (registry.find(channelKey).isEmpty()) {
                channel.forget(channelKey);
            }
        }

        LOGGER.info("Session sweep: {} lingering sessions removed, {} error and {} event entries trimmed, "
                        + "{} channels forgotten, {} live sessions",
                removed.size(), trimmedErrors, trimmedEvents, expired.size(), registry.all().size());
        return removed.size();
    }

    @PreDestroy
    public void shutdown() {
        List<QuizSession> sessions = registry.all();
        for (QuizSession session : sessions) {
            session.stop();
            session.signal(SessionSignal.stopped());
            registry.remove(session);
        }
        timers.cancelAll();
        LOGGER.info("Quiz sessions shut down, {} sessions stopped", sessions.size());
    }

    void completeSession(QuizSession session) throws InterruptedException {
        String key = session.channelKey();
        SessionSnapshot snapshot = session.complete();
        if (snapshot == null) {
            LOGGER.debug("Session for channel {} ended before it could complete", key);
            return;
        }
        registry.remove(session);
        Instant finishedAt = Instant.now();
        lastResults.put(key, new FinishedSession(snapshot, finishedAt));
        recordEvent(key, SessionEventTypes.SESSION_COMPLETED, "total=" + snapshot.total());
        LOGGER.info("Session completed for channel {}: {} questions", key, snapshot.total());
        notifyChannel(key, formatter.completionSummary(snapshot, finishedAt), "completion_summary");
    }

    void forceStop(QuizSession session, String notice) throws InterruptedException {
        String key = session.channelKey();
        SessionSnapshot snapshot = session.stop();
        if (snapshot == null) {
            return;
        }
        timers.cancelTimer(key, session);
        registry.remove(session);
        lastResults.put(key, new FinishedSession(snapshot, Instant.now()));
        recordEvent(key, SessionEventTypes.SESSION_FAILED, "cursor=" + snapshot.cursor() + ",total=" + snapshot.total());
        notifyChannel(key, notice, "fatal_notice");
    }

    void failSession(QuizSession session, String operation, Exception cause) {
        String key = session.channelKey();
        LOGGER.error("Session for channel {} failed during {}", key, operation, cause);
        recordError(key, operation, cause);
        try {
            forceStop(session, "Quiz stopped because of an error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void recordEvent(String channelKey, String eventType, String payload) {
        try {
            eventRepository.saveEvent(new SessionEvent(channelKey, eventType, Instant.now(), payload));
        } catch (DataAccessException e) {
            LOGGER.warn("Could not record {} event for channel {}: {}", eventType, channelKey, e.getMessage());
        }
    }

    void recordError(String channelKey, String operation, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        try {
            eventRepository.saveError(channelKey, new ChannelError(operation, message, Instant.now()));
        } catch (DataAccessException e) {
            LOGGER.warn("Could not record {} error for channel {}: {}", operation, channelKey, e.getMessage());
        }
    }

    private void notifyChannel(String channelKey, String content, String operation) throws InterruptedException {
        try {
            retryPolicy.execute("Send " + operation + " to channel " + channelKey,
                    attempt -> channel.send(channelKey, content));
        } catch (RetryExhaustedException e) {
            recordError(channelKey, operation, e.getCause());
        }
    }

    SessionRegistry registry() {
        return registry;
    }

    private QuizSession activeSession(String channelKey) {
        return registry.find(channelKey)
                .filter(QuizSession::isActive)
                .orElseThrow(() -> new SessionNotFoundException(channelKey));
    }
}

package com.herzen.quiz.session;

import com.herzen.quiz.error.PresentationException;
import com.herzen.quiz.error.TimerSubsystemException;
import com.herzen.quiz.presentation.PresentationChannel;
import com.herzen.quiz.presentation.PresentationChannel.MessageHandle;
import com.herzen.quiz.presentation.QuestionMessageFormatter;
import com.herzen.quiz.retry.RetryExhaustedException;
import com.herzen.quiz.retry.RetryPolicy;
import com.herzen.quiz.session.SessionModels.QuestionStep;
import com.herzen.quiz.session.SessionModels.SessionSignal;
import com.herzen.quiz.session.SessionModels.SessionTiming;
import com.herzen.quiz.timer.CountdownException;
import com.herzen.quiz.timer.TimerConflictException;
import com.herzen.quiz.timer.TimerModels.CountdownOutcome;
import com.herzen.quiz.timer.TimerModels.TimerTiming;
import com.herzen.quiz.timer.TimerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives one session from its current question to the end, one question step per loop pass:
 * present, count down (or wait in fallback mode), reveal and advance, settle. The loop reacts to
 * signals from the session's mailbox, so a stop is seen at every wait.
 */
final class SessionDriver implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionDriver.class);

    private final QuizSession session;
    private final QuizSessionService service;
    private final TimerRegistry timers;
    private final PresentationChannel channel;
    private final QuestionMessageFormatter formatter;
    private final RetryPolicy retryPolicy;
    private final SessionTiming timing;
    private final TimerTiming timerTiming;
    private final String key;

    SessionDriver(QuizSession session,
                  QuizSessionService service,
                  TimerRegistry timers,
                  PresentationChannel channel,
                  QuestionMessageFormatter formatter,
                  RetryPolicy retryPolicy,
                  SessionTiming timing,
                  TimerTiming timerTiming) {
        this.session = session;
        this.service = service;
        this.timers = timers;
        this.channel = channel;
        this.formatter = formatter;
        this.retryPolicy = retryPolicy;
        this.timing = timing;
        this.timerTiming = timerTiming;
        this.key = session.channelKey();
    }

    @Override
    public void run() {
        LOGGER.debug("Session driver started for channel {}", key);
        try {
            while (session.isActive()) {
                if (session.isPaused()) {
                    if (!awaitResume()) {
                        break;
                    }
                    continue;
                }
                QuestionStep step = session.currentStep();
                if (step == null) {
                    break;
                }
                MessageHandle handle = present(step);
                if (!session.isActive()) {
                    break;
                }
                if (!countDown(step, handle)) {
                    break;
                }
                if (!revealAndAdvance(step, handle)) {
                    break;
                }
                if (!settle()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Session driver for channel {} interrupted", key);
        } catch (RuntimeException e) {
            service.failSession(session, "present_question", e);
        } finally {
            session.releaseDriver();
            LOGGER.debug("Session driver finished for channel {}", key);
        }
    }

    private MessageHandle present(QuestionStep step) throws InterruptedException {
        String content = formatter.question(session.snapshot().questionSetName(), step.index(), step.total(),
                step.question(), session.settings().timerDurationSeconds());
        MessageHandle handle;
        try {
            handle = retryPolicy.execute("Send question " + (step.index() + 1) + " to channel " + key,
                    attempt -> channel.send(key, content));
        } catch (RetryExhaustedException e) {
            throw new PresentationException("Could not send question to channel " + key, e.getCause());
        }
        service.recordEvent(key, SessionEventTypes.QUESTION_PRESENTED, "index=" + step.index() + ",total=" + step.total());
        return handle;
    }

    // false if the session was stopped before the time ran out
    private boolean countDown(QuestionStep step, MessageHandle handle) throws InterruptedException {
        int duration = session.settings().timerDurationSeconds();
        String setName = session.snapshot().questionSetName();
        CompletableFuture<CountdownOutcome> countdown;
        try {
            countdown = session.ifActive(() -> timers.startTimer(key, session, duration,
                    remaining -> channel.edit(handle, formatter.question(setName, step.index(), step.total(), step.question(), remaining)),
                    () -> session.signal(SessionSignal.expired(step.index()))));
        } catch (TimerConflictException e) {
            LOGGER.error("Another timer is still live for channel {}, stopping the quiz", key);
            service.recordError(key, "start_timer", e);
            service.forceStop(session, formatter.fatalTimerNotice());
            return false;
        } catch (TimerSubsystemException e) {
            LOGGER.warn("Timer unavailable for channel {}, continuing without it: {}", key, e.getMessage());
            service.recordError(key, "start_timer", e);
            return waitWithoutTimer(step, handle, duration);
        }

        if (countdown == null) {
            return false;
        }
        if (!session.isActive()) {
            timers.cancelTimer(key, session);
            return false;
        }
        // a pause that raced with timer registration
        if (session.isPaused()) {
            timers.pauseTimer(key, session);
            if (!session.isPaused()) {
                timers.resumeTimer(key, session);
            }
        }

        countdown.whenComplete((outcome, error) -> {
            CountdownOutcome result = outcome;
            if (error != null) {
                service.recordError(key, "countdown", error);
                result = error instanceof CountdownException ? ((CountdownException) error).outcome() : CountdownOutcome.CANCELLED;
            }
            if (result == CountdownOutcome.CANCELLED) {
                session.signal(SessionSignal.timerLost(step.index()));
            }
        });
        return awaitExpiry(step.index());
    }

    private boolean awaitExpiry(int index) throws InterruptedException {
        while (true) {
            SessionSignal signal = session.mailbox().take();
            switch (signal.kind()) {
                case STOPPED:
                    return false;
                case EXPIRED:
                    if (signal.questionIndex() == index) {
                        return true;
                    }
                    break;
                case TIMER_LOST:
                    if (signal.questionIndex() == index) {
                        if (!session.isActive()) {
                            return false;
                        }
                        LOGGER.warn("Timer for channel {} ended without expiring, revealing question {} now", key, index + 1);
                        return true;
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private boolean waitWithoutTimer(QuestionStep step, MessageHandle handle, int duration) throws InterruptedException {
        service.recordEvent(key, SessionEventTypes.TIMER_FALLBACK, "index=" + step.index());
        String notice = formatter.fallbackNotice(session.snapshot().questionSetName(), step.index(), step.total(),
                step.question(), duration);
        try {
            channel.edit(handle, notice);
        } catch (PresentationException e) {
            service.recordError(key, "fallback_notice", e);
        }
        return sleepUnlessStopped(timerTiming.tick().multipliedBy(duration));
    }

    private boolean revealAndAdvance(QuestionStep step, MessageHandle handle) throws InterruptedException {
        if (!timers.cancelTimer(key, session)) {
            LOGGER.warn("Residual timer for channel {} was evicted forcibly before reveal", key);
        }
        if (!session.isActive()) {
            return false;
        }
        String content = formatter.reveal(session.snapshot().questionSetName(), step.index(), step.total(),
                step.question(), step.last(), timing.settleDelay());
        try {
            retryPolicy.execute("Reveal answer in channel " + key, attempt -> {
                channel.edit(handle, content);
                return null;
            });
        } catch (RetryExhaustedException e) {
            service.recordError(key, "reveal_answer", e.getCause());
        }
        if (!session.isActive()) {
            return false;
        }
        service.recordEvent(key, SessionEventTypes.ANSWER_REVEALED, "index=" + step.index());

        if (step.last()) {
            service.completeSession(session);
            return false;
        }
        return session.advance();
    }

    private boolean settle() throws InterruptedException {
        if (!sleepUnlessStopped(timing.settleDelay()) || !sleepUnlessStopped(timing.cleanupDelay())) {
            return false;
        }
        if (timers.isReady(key)) {
            return true;
        }
        LOGGER.warn("Timer not ready for channel {} before next question, cleaning up again", key);
        if (session.ifActive(() -> timers.cancelTimer(key)) == null) {
            return false;
        }
        if (!sleepUnlessStopped(timing.readinessRetryDelay())) {
            return false;
        }
        if (timers.isReady(key)) {
            return true;
        }
        LOGGER.error("Timer for channel {} still not ready, stopping the quiz", key);
        service.forceStop(session, formatter.fatalTimerNotice());
        return false;
    }

    private boolean awaitResume() throws InterruptedException {
        while (session.isPaused()) {
            SessionSignal signal = session.mailbox().poll(timerTiming.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            if (signal != null && signal.kind() == SessionSignal.Kind.STOPPED) {
                return false;
            }
        }
        return session.isActive();
    }

    private boolean sleepUnlessStopped(Duration duration) throws InterruptedException {
        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                return session.isActive();
            }
            SessionSignal signal = session.mailbox().poll(left, TimeUnit.NANOSECONDS);
            if (signal != null && signal.kind() == SessionSignal.Kind.STOPPED) {
                return false;
            }
        }
    }
}

package com.herzen.quiz.timer;

import com.herzen.quiz.timer.TimerModels.CompletionCallback;
import com.herzen.quiz.timer.TimerModels.CountdownOutcome;
import com.herzen.quiz.timer.TimerModels.TickCallback;
import com.herzen.quiz.timer.TimerModels.TimerState;
import com.herzen.quiz.timer.TimerModels.TimerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-use, pausable and cancellable countdown for one question step.
 *
 * <p>{@link #run} blocks the calling thread for the whole countdown. While running it calls the tick
 * callback once per tick with the seconds still left, then waits one tick and decrements. While paused
 * it polls without decrementing. Pause, resume and cancel wake the waiting thread through a condition,
 * so a cancel is observed well within one poll interval even while paused.</p>
 */
public final class CountdownTimer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CountdownTimer.class);

    private final String channelKey;
    private final Duration tick;
    private final Duration pollInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private TimerState state = TimerState.IDLE;
    private int remainingSeconds;
    private int totalSeconds;
    private boolean paused;
    private boolean cancelled;

    public CountdownTimer(String channelKey, Duration tick, Duration pollInterval) {
        this.channelKey = channelKey;
        this.tick = tick;
        this.pollInterval = pollInterval;
    }

    public CountdownOutcome run(int durationSeconds, TickCallback onTick, CompletionCallback onComplete) {
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got " + durationSeconds);
        }

        lock.lock();
        try {
            if (state != TimerState.IDLE) {
                throw new IllegalStateException("Countdown for channel " + channelKey + " already " + state);
            }
            totalSeconds = durationSeconds;
            remainingSeconds = durationSeconds;
            if (cancelled) {
                state = TimerState.CANCELLED;
                LOGGER.debug("Countdown for channel {} cancelled before it started", channelKey);
                return CountdownOutcome.CANCELLED;
            }
            state = paused ? TimerState.PAUSED : TimerState.RUNNING;
        } finally {
            lock.unlock();
        }
        LOGGER.info("Countdown started for channel {}: {}s", channelKey, durationSeconds);

        List<Exception> failures = new ArrayList<>();
        boolean interrupted = false;
        try {
            int current;
            while ((current = awaitTickSlot()) > 0) {
                try {
                    onTick.onTick(current);
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                } catch (Exception e) {
                    LOGGER.warn("Tick callback failed for channel {} at {}s: {}", channelKey, current, e.getMessage());
                    failures.add(e);
                }
                if (!awaitTickElapsed()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
        }
        if (interrupted) {
            cancel();
        }

        CountdownOutcome outcome = finish();
        if (outcome == CountdownOutcome.COMPLETED) {
            LOGGER.info("Countdown for channel {} expired naturally after {}s", channelKey, totalSeconds);
            try {
                onComplete.onComplete();
            } catch (Exception e) {
                LOGGER.warn("Completion callback failed for channel {}: {}", channelKey, e.getMessage());
                failures.add(e);
            }
        } else {
            LOGGER.info("Countdown for channel {} cancelled with {}s left", channelKey, remainingSeconds());
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (!failures.isEmpty()) {
            throw new CountdownException(channelKey, outcome, failures);
        }
        return outcome;
    }

    public boolean pause() {
        lock.lock();
        try {
            if (paused || isTerminal()) {
                return false;
            }
            paused = true;
            if (state == TimerState.RUNNING) {
                state = TimerState.PAUSED;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Countdown for channel {} paused", channelKey);
        return true;
    }

    public boolean resume() {
        lock.lock();
        try {
            if (!paused || isTerminal()) {
                return false;
            }
            paused = false;
            if (state == TimerState.PAUSED) {
                state = TimerState.RUNNING;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Countdown for channel {} resumed", channelKey);
        return true;
    }

    public boolean cancel() {
        lock.lock();
        try {
            if (cancelled || state == TimerState.COMPLETED) {
                return false;
            }
            cancelled = true;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public TimerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    public int remainingSeconds() {
        lock.lock();
        try {
            return remainingSeconds;
        } finally {
            lock.unlock();
        }
    }

    public TimerStatus status() {
        lock.lock();
        try {
            return new TimerStatus(channelKey, remainingSeconds, totalSeconds, paused, cancelled, state);
        } finally {
            lock.unlock();
        }
    }

    // > 0: seconds left and time to tick, 0: expired, -1: cancelled
    private int awaitTickSlot() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (cancelled) {
                    return -1;
                }
                if (remainingSeconds <= 0) {
                    return 0;
                }
                if (!paused) {
                    return remainingSeconds;
                }
                changed.awaitNanos(pollInterval.toNanos());
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean awaitTickElapsed() throws InterruptedException {
        lock.lock();
        try {
            long nanos = tick.toNanos();
            while (nanos > 0 && !cancelled) {
                nanos = changed.awaitNanos(nanos);
            }
            if (cancelled) {
                return false;
            }
            remainingSeconds--;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private CountdownOutcome finish() {
        lock.lock();
        try {
            if (cancelled || remainingSeconds > 0) {
                cancelled = true;
                state = TimerState.CANCELLED;
                return CountdownOutcome.CANCELLED;
            }
            state = TimerState.COMPLETED;
            return CountdownOutcome.COMPLETED;
        } finally {
            lock.unlock();
        }
    }

    private boolean isTerminal() {
        return state == TimerState.COMPLETED || state == TimerState.CANCELLED;
    }
}

package com.herzen.quiz.timer;

import com.herzen.quiz.retry.RetryExhaustedException;
import com.herzen.quiz.retry.RetryPolicy;
import com.herzen.quiz.timer.TimerModels.CompletionCallback;
import com.herzen.quiz.timer.TimerModels.CountdownOutcome;
import com.herzen.quiz.timer.TimerModels.TickCallback;
import com.herzen.quiz.timer.TimerModels.TimerStatus;
import com.herzen.quiz.timer.TimerModels.TimerTiming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Owns at most one live {@link CountdownTimer} per channel key.
 *
 * <p>A record enters the map before its countdown is handed to the executor and leaves it when the
 * countdown finishes, when it is cancelled, or when it is found finished by {@link #isReady}. Removal
 * is always by identity, so a late-finishing countdown never removes its successor.</p>
 */
public class TimerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimerRegistry.class);

    private final Map<String, TimerRecord> timers = new ConcurrentHashMap<>();
    private final Executor executor;
    private final RetryPolicy retryPolicy;
    private final TimerTiming timing;

    public TimerRegistry(Executor executor, RetryPolicy retryPolicy, TimerTiming timing) {
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.timing = timing;
    }

    public boolean isReady(String channelKey) {
        TimerRecord record = timers.get(channelKey);
        if (record == null) {
            return true;
        }
        if (record.isLive()) {
            LOGGER.debug("Timer for channel {} still live: {}", channelKey, record.timer().status());
            return false;
        }
        if (timers.remove(channelKey, record)) {
            LOGGER.debug("Evicted finished timer for channel {}", channelKey);
        }
        return true;
    }

    public CompletableFuture<CountdownOutcome> startTimer(String channelKey,
                                                         int durationSeconds,
                                                         TickCallback onTick,
                                                         CompletionCallback onComplete) {
        return startTimer(channelKey, null, durationSeconds, onTick, onComplete);
    }

    public CompletableFuture<CountdownOutcome> startTimer(String channelKey,
                                                         Object owner,
                                                         int durationSeconds,
                                                         TickCallback onTick,
                                                         CompletionCallback onComplete) {
        ensureReady(channelKey);
        try {
            return retryPolicy.execute("Timer start for channel " + channelKey,
                    attempt -> register(channelKey, owner, durationSeconds, onTick, onComplete, attempt));
        } catch (RetryExhaustedException e) {
            if (e.getCause() instanceof TimerConflictException) {
                throw (TimerConflictException) e.getCause();
            }
            throw new TimerStartException(channelKey, e.attempts(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimerStartException(channelKey, 0, e);
        }
    }

    /**
     * Cancels the channel's timer and waits for its countdown to acknowledge. A countdown that does
     * not acknowledge within the cancel timeout is evicted anyway. Either way the channel is ready
     * afterwards.
     *
     * @return whether the countdown acknowledged within the timeout
     */
    public boolean cancelTimer(String channelKey) {
        TimerRecord record = timers.get(channelKey);
        if (record == null) {
            return true;
        }
        return cancel(channelKey, record);
    }

    // leaves a timer started by another owner alone
    public boolean cancelTimer(String channelKey, Object owner) {
        TimerRecord record = timers.get(channelKey);
        if (record == null || record.owner() != owner) {
            return true;
        }
        return cancel(channelKey, record);
    }

    private boolean cancel(String channelKey, TimerRecord record) {
        long started = System.nanoTime();
        record.timer().cancel();

        boolean acknowledged;
        if (record.runsOnCurrentThread()) {
            // called from inside the countdown's own callback; it ends as soon as the callback returns
            acknowledged = true;
        } else {
            try {
                acknowledged = record.awaitFinished(timing.cancelTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                acknowledged = false;
            }
        }
        timers.remove(channelKey, record);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (acknowledged) {
            LOGGER.debug("Timer for channel {} cancelled in {} ms", channelKey, elapsedMs);
        } else {
            LOGGER.warn("Timer for channel {} did not acknowledge cancellation within {} ms, evicted forcibly",
                    channelKey, timing.cancelTimeout().toMillis());
        }
        return acknowledged;
    }

    public boolean pauseTimer(String channelKey) {
        TimerRecord record = timers.get(channelKey);
        if (record == null) {
            return false;
        }
        record.timer().pause();
        return true;
    }

    public boolean resumeTimer(String channelKey) {
        TimerRecord record = timers.get(channelKey);
        if (record == null) {
            return false;
        }
        record.timer().resume();
        return true;
    }

    public boolean pauseTimer(String channelKey, Object owner) {
        TimerRecord record = timers.get(channelKey);
        if (record == null || record.owner() != owner) {
            return false;
        }
        record.timer().pause();
        return true;
    }

    public boolean resumeTimer(String channelKey, Object owner) {
        TimerRecord record = timers.get(channelKey);
        if (record == null || record.owner() != owner) {
            return false;
        }
        record.timer().resume();
        return true;
    }

    public Optional<TimerStatus> status(String channelKey) {
        return Optional.ofNullable(timers.get(channelKey)).map(r -> r.timer().status());
    }

    public int size() {
        return timers.size();
    }

    public void cancelAll() {
        List.copyOf(timers.keySet()).forEach(this::cancelTimer);
    }

    private void ensureReady(String channelKey) {
        try {
            retryPolicy.execute("Timer readiness for channel " + channelKey, attempt -> {
                if (isReady(channelKey)) {
                    return null;
                }
                LOGGER.warn("Live timer already registered for channel {} (attempt {}), cancelling it", channelKey, attempt);
                cancelTimer(channelKey);
                if (isReady(channelKey)) {
                    return null;
                }
                throw new TimerConflictException(channelKey);
            });
        } catch (RetryExhaustedException e) {
            throw new TimerConflictException(channelKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimerConflictException(channelKey);
        }
    }

    private CompletableFuture<CountdownOutcome> register(String channelKey,
                                                        Object owner,
                                                        int durationSeconds,
                                                        TickCallback onTick,
                                                        CompletionCallback onComplete,
                                                        int attempt) {
        TimerRecord record = new TimerRecord(new CountdownTimer(channelKey, timing.tick(), timing.pollInterval()), owner);
        if (timers.putIfAbsent(channelKey, record) != null) {
            LOGGER.warn("Race detected: another timer was registered for channel {} during start (attempt {})", channelKey, attempt);
            ensureReady(channelKey);
            if (timers.putIfAbsent(channelKey, record) != null) {
                throw new TimerConflictException(channelKey);
            }
        }
        try {
            executor.execute(() -> runCountdown(channelKey, record, durationSeconds, onTick, onComplete));
        } catch (RuntimeException e) {
            timers.remove(channelKey, record);
            throw e;
        }
        LOGGER.info("Timer registered for channel {}: {}s (attempt {})", channelKey, durationSeconds, attempt);
        return record.completion();
    }

    private void runCountdown(String channelKey,
                              TimerRecord record,
                              int durationSeconds,
                              TickCallback onTick,
                              CompletionCallback onComplete) {
        record.bindRunner(Thread.currentThread());
        try {
            record.completion().complete(record.timer().run(durationSeconds, onTick, onComplete));
        } catch (RuntimeException e) {
            LOGGER.warn("Countdown for channel {} finished with error: {}", channelKey, e.getMessage());
            record.completion().completeExceptionally(e);
        } finally {
            record.markFinished();
            timers.remove(channelKey, record);
        }
    }

    private static final class TimerRecord {
        private final CountdownTimer timer;
        private final Object owner;
        private final CompletableFuture<CountdownOutcome> completion = new CompletableFuture<>();
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile Thread runner;

        private TimerRecord(CountdownTimer timer, Object owner) {
            this.timer = timer;
            this.owner = owner;
        }

        CountdownTimer timer() {
            return timer;
        }

        Object owner() {
            return owner;
        }

        CompletableFuture<CountdownOutcome> completion() {
            return completion;
        }

        void bindRunner(Thread thread) {
            runner = thread;
        }

        boolean runsOnCurrentThread() {
            return runner == Thread.currentThread() && finished.getCount() > 0;
        }

        void markFinished() {
            runner = null;
            finished.countDown();
        }

        // a cancelled countdown stays live until it acknowledges or is evicted by cancelTimer
        boolean isLive() {
            return finished.getCount() > 0;
        }

        boolean awaitFinished(Duration timeout) throws InterruptedException {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}

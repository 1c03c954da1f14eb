package com.herzen.quiz.timer;

import java.time.Duration;

public class TimerModels {
    public record TimerTiming(Duration tick, Duration pollInterval, Duration cancelTimeout) {
        public static TimerTiming defaults() {
            return new TimerTiming(Duration.ofSeconds(1), Duration.ofMillis(100), Duration.ofSeconds(2));
        }
    }

    public enum TimerState { IDLE, RUNNING, PAUSED, COMPLETED, CANCELLED }

    public enum CountdownOutcome { COMPLETED, CANCELLED }

    public record TimerStatus(String channelKey,
                              int remainingSeconds,
                              int totalSeconds,
                              boolean paused,
                              boolean cancelled,
                              TimerState state) {}

    @FunctionalInterface
    public interface TickCallback {
        void onTick(int remainingSeconds) throws Exception;
    }

    @FunctionalInterface
    public interface CompletionCallback {
        void onComplete() throws Exception;
    }
}

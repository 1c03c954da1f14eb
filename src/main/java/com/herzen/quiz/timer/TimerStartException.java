package com.herzen.quiz.timer;

import com.herzen.quiz.error.TimerSubsystemException;

public class TimerStartException extends TimerSubsystemException {
    public TimerStartException(String channelKey, int attempts, Throwable cause) {
        super("TIMER_START_FAILED", "Could not start timer for channel " + channelKey + " after " + attempts + " attempt(s)", cause);
    }
}

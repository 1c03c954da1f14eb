package com.herzen.quiz.timer;

import com.herzen.quiz.error.TimerSubsystemException;
import com.herzen.quiz.timer.TimerModels.CountdownOutcome;

import java.util.List;

public class CountdownException extends TimerSubsystemException {
    private final CountdownOutcome outcome;

    public CountdownException(String channelKey, CountdownOutcome outcome, List<Exception> failures) {
        super("COUNTDOWN_CALLBACK_FAILED",
                "Countdown for channel " + channelKey + " ended " + outcome + " with " + failures.size() + " callback failure(s)",
                failures.get(0));
        this.outcome = outcome;
        failures.stream().skip(1).forEach(this::addSuppressed);
    }

    public CountdownOutcome outcome() {
        return outcome;
    }
}

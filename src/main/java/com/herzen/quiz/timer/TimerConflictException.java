package com.herzen.quiz.timer;

import com.herzen.quiz.error.ConflictException;

public class TimerConflictException extends ConflictException {
    public TimerConflictException(String channelKey) {
        super("TIMER_CONFLICT", "A live timer is still registered for channel " + channelKey);
    }
}

package com.herzen.quiz.error;

public class SessionConflictException extends ConflictException {
    public SessionConflictException(String channelKey) {
        super("SESSION_CONFLICT", "A quiz session is already running for channel " + channelKey);
    }
}

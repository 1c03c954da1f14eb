package com.herzen.quiz.error;

public class SessionNotFoundException extends NotFoundException {
    public SessionNotFoundException(String channelKey) {
        super("SESSION_NOT_FOUND", "No active quiz session for channel " + channelKey);
    }
}

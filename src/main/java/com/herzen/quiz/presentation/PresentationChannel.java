package com.herzen.quiz.presentation;

import com.herzen.quiz.error.PresentationException;

public interface PresentationChannel {
    MessageHandle send(String channelKey, String content);

    void edit(MessageHandle handle, String content);

    default void forget(String channelKey) {
    }

    record MessageHandle(String channelKey, long messageId) {}
}

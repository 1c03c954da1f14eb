package com.herzen.quiz.error;

public class PresentationException extends QuizException {
    public PresentationException(String message) {
        super("PRESENTATION_FAILED", message);
    }

    public PresentationException(String message, Throwable cause) {
        super("PRESENTATION_FAILED", message, cause);
    }
}

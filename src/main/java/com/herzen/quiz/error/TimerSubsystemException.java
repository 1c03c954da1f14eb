package com.herzen.quiz.error;

public class TimerSubsystemException extends QuizException {
    public TimerSubsystemException(String code, String message) {
        super(code, message);
    }

    public TimerSubsystemException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}

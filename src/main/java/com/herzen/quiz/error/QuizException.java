package com.herzen.quiz.error;

public class QuizException extends RuntimeException {
    private final String code;

    public QuizException(String code, String message) {
        super(message);
        this.code = code;
    }

    public QuizException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

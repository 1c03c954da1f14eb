package com.herzen.quiz.error;

public class ConflictException extends QuizException {
    public ConflictException(String code, String message) {
        super(code, message);
    }
}

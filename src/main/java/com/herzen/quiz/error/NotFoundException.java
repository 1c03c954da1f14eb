package com.herzen.quiz.error;

public class NotFoundException extends QuizException {
    public NotFoundException(String code, String message) {
        super(code, message);
    }
}

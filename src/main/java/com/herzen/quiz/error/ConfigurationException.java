package com.herzen.quiz.error;

public class ConfigurationException extends QuizException {
    public ConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }

    protected ConfigurationException(String code, String message) {
        super(code, message);
    }
}

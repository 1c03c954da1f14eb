package com.herzen.quiz.error;

public class EmptyQuestionListException extends ConfigurationException {
    public EmptyQuestionListException() {
        super("EMPTY_INPUT", "Cannot select questions from an empty list");
    }
}

package com.herzen.quiz.error;

public class EmptyQuestionSetException extends ConfigurationException {
    public EmptyQuestionSetException(String questionSetName) {
        super("EMPTY_QUESTION_SET", "No questions available in '" + questionSetName + "' after applying settings");
    }
}

package com.herzen.quiz.error;

public class QuestionSetNotFoundException extends NotFoundException {
    public QuestionSetNotFoundException(String name) {
        super("QUESTION_SET_NOT_FOUND", "Question set not found: " + name);
    }
}

package com.herzen.quiz.api;

import com.herzen.quiz.domain.DomainModels.QuizSettings;

/**
 * Partial settings: a null field keeps the base value, {@code allQuestions=true} clears the question count.
 */
public record SettingsRequest(Integer questionCount, Boolean allQuestions, Boolean randomOrder, Integer timerDurationSeconds) {
    public QuizSettings applyTo(QuizSettings base) {
        QuizSettings result = base;
        if (Boolean.TRUE.equals(allQuestions)) {
            result = result.withQuestionCount(null);
        } else if (questionCount != null) {
            result = result.withQuestionCount(questionCount);
        }
        if (randomOrder != null) {
            result = result.withRandomOrder(randomOrder);
        }
        if (timerDurationSeconds != null) {
            result = result.withTimerDuration(timerDurationSeconds);
        }
        return result;
    }
}

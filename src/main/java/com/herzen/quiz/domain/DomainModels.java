package com.herzen.quiz.domain;

import java.util.List;

public class DomainModels {
    public record Question(String text, String answer, List<String> options) {
        public Question {
            options = options == null ? List.of() : List.copyOf(options);
        }

        public Question(String text, String answer) {
            this(text, answer, List.of());
        }
    }

    // questionCount == null: every question of the set
    public record QuizSettings(Integer questionCount, boolean randomOrder, int timerDurationSeconds) {
        public QuizSettings withQuestionCount(Integer count) {
            return new QuizSettings(count, randomOrder, timerDurationSeconds);
        }

        public QuizSettings withRandomOrder(boolean random) {
            return new QuizSettings(questionCount, random, timerDurationSeconds);
        }

        public QuizSettings withTimerDuration(int seconds) {
            return new QuizSettings(questionCount, randomOrder, seconds);
        }
    }
}

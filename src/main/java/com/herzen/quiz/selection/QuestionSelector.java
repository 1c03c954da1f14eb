package com.herzen.quiz.selection;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.EmptyQuestionListException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Component
public class QuestionSelector {
    private final Random random;

    public QuestionSelector() {
        this(new Random());
    }

    public QuestionSelector(Random random) {
        this.random = random;
    }

    public List<Question> select(List<Question> questions, QuizSettings settings) {
        if (questions == null || questions.isEmpty()) {
            throw new EmptyQuestionListException();
        }

        List<Question> selected = new ArrayList<>(questions);
        if (settings.randomOrder()) {
            Collections.shuffle(selected, random);
        }

        Integer count = settings.questionCount();
        if (count != null) {
            if (count < 1) {
                return List.of();
            }
            selected = selected.subList(0, Math.min(count, selected.size()));
        }
        return List.copyOf(selected);
    }
}

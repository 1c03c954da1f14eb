package com.herzen.quiz.questionset;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.questionset.QuestionSetModels.LoadSummary;
import com.herzen.quiz.questionset.QuestionSetModels.ValidationIssue;

import java.util.List;
import java.util.Optional;

public interface QuestionSetRepository {
    List<String> listNames();

    boolean exists(String name);

    Optional<List<Question>> getQuestions(String name);

    LoadSummary reload();

    List<ValidationIssue> loadErrors();
}

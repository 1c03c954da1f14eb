package com.herzen.quiz.questionset;

import java.util.List;

public class QuestionSetModels {
    public record ValidationIssue(String code, String message, String file, Integer questionIndex) {}

    public record LoadSummary(int loadedSets,
                              List<String> names,
                              List<ValidationIssue> errors,
                              boolean fallbackActive) {}
}

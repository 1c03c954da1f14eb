package com.herzen.quiz.questionset;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.quiz.questionset.QuestionSetModels.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class QuestionSetValidator {
    public List<ValidationIssue> validate(String file, JsonNode root) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (root == null || !root.isObject()) {
            issues.add(new ValidationIssue("NOT_AN_OBJECT", "Question set must be a JSON object", file, null));
            return issues;
        }

        JsonNode quiz = root.get("quiz");
        if (quiz == null || !quiz.isArray()) {
            issues.add(new ValidationIssue("MISSING_QUIZ_ARRAY", "Question set must contain a 'quiz' array", file, null));
            return issues;
        }
        if (quiz.isEmpty()) {
            issues.add(new ValidationIssue("EMPTY_QUIZ", "'quiz' array cannot be empty", file, null));
            return issues;
        }

        for (int i = 0; i < quiz.size(); i++) {
            JsonNode q = quiz.get(i);
            if (!q.isObject()) {
                issues.add(new ValidationIssue("QUESTION_NOT_OBJECT", "Question " + i + " must be an object", file, i));
                continue;
            }
            if (!q.hasNonNull("question") || !q.get("question").isTextual()) {
                issues.add(new ValidationIssue("MISSING_QUESTION", "Question " + i + " needs a 'question' string", file, i));
            }
            if (!q.hasNonNull("answer") || !q.get("answer").isTextual()) {
                issues.add(new ValidationIssue("MISSING_ANSWER", "Question " + i + " needs an 'answer' string", file, i));
            }
            JsonNode options = q.get("options");
            if (options != null && !options.isNull()) {
                if (!options.isArray()) {
                    issues.add(new ValidationIssue("INVALID_OPTIONS", "Question " + i + " 'options' must be an array", file, i));
                } else {
                    for (JsonNode option : options) {
                        if (!option.isTextual()) {
                            issues.add(new ValidationIssue("INVALID_OPTIONS", "Question " + i + " 'options' must contain strings", file, i));
                            break;
                        }
                    }
                }
            }
        }
        return issues;
    }
}

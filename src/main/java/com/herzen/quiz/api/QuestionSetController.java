package com.herzen.quiz.api;

import com.herzen.quiz.questionset.QuestionSetModels;
import com.herzen.quiz.questionset.QuestionSetRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/question-sets")
public class QuestionSetController {
    private final QuestionSetRepository questionSets;

    public QuestionSetController(QuestionSetRepository questionSets) {
        this.questionSets = questionSets;
    }

    @GetMapping
    public ResponseEntity<QuestionSetsResponse> list() {
        return ResponseEntity.ok(new QuestionSetsResponse(questionSets.listNames(), questionSets.loadErrors()));
    }

    @PostMapping("/reload")
    public ResponseEntity<QuestionSetModels.LoadSummary> reload() {
        return ResponseEntity.ok(questionSets.reload());
    }

    public record QuestionSetsResponse(List<String> names, List<QuestionSetModels.ValidationIssue> loadErrors) {}
}

package com.herzen.quiz.questionset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.questionset.QuestionSetModels.LoadSummary;
import com.herzen.quiz.questionset.QuestionSetModels.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

@Repository
public class JsonQuestionSetRepository implements QuestionSetRepository {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonQuestionSetRepository.class);
    static final String SAMPLE_SET = "sample_quiz";
    static final String FALLBACK_SET = "fallback_quiz";

    private final ObjectMapper objectMapper;
    private final QuestionSetValidator validator;
    private final Path directory;

    private volatile Map<String, List<Question>> sets = Map.of();
    private volatile List<ValidationIssue> errors = List.of();
    private volatile boolean fallbackActive;

    public JsonQuestionSetRepository(ObjectMapper objectMapper,
                                     QuestionSetValidator validator,
                                     @Value("${quiz.question-sets.directory:./quizzes}") String directory) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.directory = Path.of(directory);
        reload();
    }

    @Override
    public List<String> listNames() {
        return List.copyOf(sets.keySet());
    }

    @Override
    public boolean exists(String name) {
        return name != null && sets.containsKey(name);
    }

    @Override
    public Optional<List<Question>> getQuestions(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(sets.get(name));
    }

    @Override
    public List<ValidationIssue> loadErrors() {
        return errors;
    }

    @Override
    public synchronized LoadSummary reload() {
        Map<String, List<Question>> loaded = new LinkedHashMap<>();
        List<ValidationIssue> issues = new ArrayList<>();
        boolean fallback = false;

        try {
            Files.createDirectories(directory);
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(p -> p.getFileName().toString().endsWith(".json"))
                        .sorted()
                        .forEach(p -> loadFile(p, loaded, issues));
            }
        } catch (IOException e) {
            LOGGER.error("Cannot read question set directory {}: {}", directory, e.getMessage());
            issues.add(new ValidationIssue("DIRECTORY_UNREADABLE", e.getMessage(), directory.toString(), null));
        }

        if (loaded.isEmpty()) {
            try {
                loaded.put(SAMPLE_SET, writeSampleSet());
            } catch (IOException e) {
                LOGGER.warn("Could not create sample question set in {}: {}", directory, e.getMessage());
                issues.add(new ValidationIssue("SAMPLE_NOT_CREATED", e.getMessage(), directory.toString(), null));
                loaded.put(FALLBACK_SET, List.of(new Question(
                        "This is a fallback question. What should you do when question sets can't be loaded?",
                        "Check the question set directory and file permissions")));
                fallback = true;
            }
        }

        this.sets = Collections.unmodifiableMap(loaded);
        this.errors = List.copyOf(issues);
        this.fallbackActive = fallback;
        LOGGER.info("Loaded {} question set(s) from {} ({} issue(s))", loaded.size(), directory, issues.size());
        return new LoadSummary(loaded.size(), List.copyOf(loaded.keySet()), this.errors, fallback);
    }

    public boolean isFallbackActive() {
        return fallbackActive;
    }

    private void loadFile(Path path, Map<String, List<Question>> loaded, List<ValidationIssue> issues) {
        String file = path.getFileName().toString();
        String name = file.substring(0, file.length() - ".json".length());
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            LOGGER.warn("Invalid JSON in {}: {}", path, e.getMessage());
            issues.add(new ValidationIssue("INVALID_JSON", e.getMessage(), file, null));
            return;
        }

        List<ValidationIssue> fileIssues = validator.validate(file, root);
        if (!fileIssues.isEmpty()) {
            LOGGER.warn("Skipping question set {}: {}", file, fileIssues.get(0).message());
            issues.addAll(fileIssues);
            return;
        }
        loaded.put(name, parse(root));
    }

    private List<Question> parse(JsonNode root) {
        List<Question> questions = new ArrayList<>();
        for (JsonNode q : root.get("quiz")) {
            List<String> options = new ArrayList<>();
            JsonNode optionNodes = q.get("options");
            if (optionNodes != null && optionNodes.isArray()) {
                optionNodes.forEach(o -> options.add(o.asText()));
            }
            questions.add(new Question(q.get("question").asText(), q.get("answer").asText(), options));
        }
        return List.copyOf(questions);
    }

    private List<Question> writeSampleSet() throws IOException {
        List<Question> sample = List.of(
                new Question("What is the capital of France?", "Paris"),
                new Question("What is 2 + 2?", "4"),
                new Question("What programming language is this service written in?", "Java"));

        Path file = directory.resolve(SAMPLE_SET + ".json");
        if (!Files.exists(file)) {
            ObjectNode root = objectMapper.createObjectNode();
            ArrayNode quiz = root.putArray("quiz");
            sample.forEach(q -> quiz.addObject().put("question", q.text()).put("answer", q.answer()));
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
            LOGGER.info("Created sample question set {}", file);
        }
        return sample;
    }
}

package com.herzen.quiz.settings;

import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

@Component
public class QuizSettingsStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuizSettingsStore.class);
    private static final int MIN_QUESTION_COUNT = 1;

    private final int minTimerSeconds;
    private final int maxTimerSeconds;
    private final int maxQuestionCount;
    private final QuizSettings defaults;
    private final AtomicReference<QuizSettings> current;

    public QuizSettingsStore(@Value("${quiz.defaults.question-count:}") Integer defaultQuestionCount,
                             @Value("${quiz.defaults.random-order:false}") boolean defaultRandomOrder,
                             @Value("${quiz.defaults.timer-seconds:30}") int defaultTimerSeconds,
                             @Value("${quiz.limits.min-timer-seconds:5}") int minTimerSeconds,
                             @Value("${quiz.limits.max-timer-seconds:300}") int maxTimerSeconds,
                             @Value("${quiz.limits.max-question-count:100}") int maxQuestionCount) {
        this.minTimerSeconds = minTimerSeconds;
        this.maxTimerSeconds = maxTimerSeconds;
        this.maxQuestionCount = maxQuestionCount;
        this.defaults = validate(new QuizSettings(defaultQuestionCount, defaultRandomOrder, defaultTimerSeconds));
        this.current = new AtomicReference<>(defaults);
    }

    public QuizSettings current() {
        return current.get();
    }

    public QuizSettings setQuestionCount(Integer count) {
        return replace(current.get().withQuestionCount(count));
    }

    public QuizSettings setRandomOrder(boolean randomOrder) {
        return replace(current.get().withRandomOrder(randomOrder));
    }

    public QuizSettings toggleRandomOrder() {
        return current.updateAndGet(s -> s.withRandomOrder(!s.randomOrder()));
    }

    public QuizSettings setTimerDuration(int seconds) {
        return replace(current.get().withTimerDuration(seconds));
    }

    public QuizSettings update(QuizSettings settings) {
        return replace(settings);
    }

    public QuizSettings reset() {
        current.set(defaults);
        LOGGER.info("Quiz settings reset to defaults: {}", defaults);
        return defaults;
    }

    public QuizSettings validate(QuizSettings settings) {
        if (settings == null) {
            throw new ConfigurationException("Settings are required");
        }
        Integer count = settings.questionCount();
        if (count != null && count < MIN_QUESTION_COUNT) {
            throw new ConfigurationException("Question count must be at least " + MIN_QUESTION_COUNT + ", got " + count);
        }
        if (count != null && count > maxQuestionCount) {
            throw new ConfigurationException("Question count cannot exceed " + maxQuestionCount + ", got " + count);
        }
        int timer = settings.timerDurationSeconds();
        if (timer < minTimerSeconds || timer > maxTimerSeconds) {
            throw new ConfigurationException("Timer duration must be between " + minTimerSeconds + " and "
                    + maxTimerSeconds + " seconds, got " + timer);
        }
        return settings;
    }

    public String summary() {
        QuizSettings s = current.get();
        return "Questions: " + (s.questionCount() == null ? "All available" : s.questionCount())
                + " | Order: " + (s.randomOrder() ? "Random" : "Sequential")
                + " | Timer: " + s.timerDurationSeconds() + "s per question";
    }

    private QuizSettings replace(QuizSettings candidate) {
        validate(candidate);
        current.set(candidate);
        LOGGER.info("Quiz settings updated: {}", candidate);
        return candidate;
    }
}

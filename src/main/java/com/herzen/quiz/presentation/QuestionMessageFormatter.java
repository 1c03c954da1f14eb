package com.herzen.quiz.presentation;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.session.SessionModels.SessionSnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class QuestionMessageFormatter {
    private static final int URGENT_SECONDS = 3;

    public String question(String questionSetName, int index, int total, Question question, int remainingSeconds) {
        StringBuilder sb = header("Question", index, total, question);
        sb.append('\n').append(remainingSeconds <= URGENT_SECONDS ? "[!] " : "")
                .append("Time remaining: ").append(remainingSeconds).append(remainingSeconds == 1 ? " second" : " seconds");
        sb.append("\nQuiz: ").append(questionSetName);
        sb.append('\n').append(remainingSeconds <= URGENT_SECONDS ? "Time running out!" : "Answer will be revealed when time expires");
        return sb.toString();
    }

    public String fallbackNotice(String questionSetName, int index, int total, Question question, int timerSeconds) {
        StringBuilder sb = header("Question", index, total, question);
        sb.append("\nTimer unavailable - question will auto-advance");
        sb.append("\nQuiz: ").append(questionSetName);
        sb.append("\nAnswer will be revealed in ").append(timerSeconds).append(" seconds");
        return sb.toString();
    }

    public String reveal(String questionSetName, int index, int total, Question question, boolean last, Duration settleDelay) {
        StringBuilder sb = header("Time's up! Question", index, total, question);
        sb.append("\nCorrect answer: ").append(question.answer());
        sb.append("\nQuiz: ").append(questionSetName);
        if (last) {
            sb.append("\nQuiz complete! That was the final question.");
        } else {
            sb.append("\nNext question in ").append(Math.max(1, settleDelay.toSeconds())).append(" seconds...");
        }
        return sb.toString();
    }

    public String completionSummary(SessionSnapshot snapshot, Instant finishedAt) {
        long totalSeconds = Math.max(0, Duration.between(snapshot.startedAt(), finishedAt).toSeconds());
        int questions = Math.max(1, snapshot.total());
        QuizSettings settings = snapshot.settings();
        return "Quiz complete! " + snapshot.questionSetName() + " has been completed."
                + "\nQuestions completed: " + snapshot.total()
                + "\nTotal time: " + (totalSeconds / 60) + "m " + (totalSeconds % 60) + "s"
                + "\nAverage per question: " + (totalSeconds / questions) + "s"
                + "\nOrder: " + (settings.randomOrder() ? "Random" : "Sequential")
                + "\nTimer: " + settings.timerDurationSeconds() + " seconds per question"
                + "\nQuestions: " + (settings.questionCount() == null ? "All available" : settings.questionCount());
    }

    public String fatalTimerNotice() {
        return "Timer error occurred. Quiz has been stopped.";
    }

    public String statusSummary(SessionSnapshot snapshot, Instant now) {
        long elapsed = Math.max(0, Duration.between(snapshot.startedAt(), now).toSeconds());
        int shown = Math.min(snapshot.cursor() + 1, snapshot.total());
        return String.join(" | ", List.of(
                "Quiz: " + snapshot.questionSetName(),
                "Progress: " + shown + "/" + snapshot.total(),
                "Status: " + capitalize(snapshot.state().name()),
                "Order: " + (snapshot.settings().randomOrder() ? "Random" : "Sequential"),
                "Timer: " + snapshot.settings().timerDurationSeconds() + "s per question",
                "Duration: " + (elapsed / 60) + "m " + (elapsed % 60) + "s"));
    }

    private StringBuilder header(String title, int index, int total, Question question) {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append(' ').append(index + 1).append('/').append(total).append('\n').append(question.text());
        List<String> options = question.options();
        for (int i = 0; i < options.size(); i++) {
            sb.append('\n').append((char) ('A' + i)).append(") ").append(options.get(i));
        }
        return sb;
    }

    private static String capitalize(String value) {
        return value.charAt(0) + value.substring(1).toLowerCase();
    }
}

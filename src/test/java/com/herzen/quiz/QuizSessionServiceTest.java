package com.herzen.quiz;

import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.ConfigurationException;
import com.herzen.quiz.error.QuestionSetNotFoundException;
import com.herzen.quiz.error.SessionConflictException;
import com.herzen.quiz.error.SessionNotFoundException;
import com.herzen.quiz.presentation.InMemoryChannelFeed;
import com.herzen.quiz.repository.SessionEventJdbcRepository;
import com.herzen.quiz.session.QuizSessionService;
import com.herzen.quiz.session.SessionEventTypes;
import com.herzen.quiz.session.SessionModels;
import com.herzen.quiz.timer.TimerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class QuizSessionServiceTest {
    @Autowired
    private QuizSessionService sessionService;

    @Autowired
    private InMemoryChannelFeed feed;

    @Autowired
    private TimerRegistry timers;

    @Autowired
    private SessionEventJdbcRepository eventRepository;

    @Value("${quiz.session.event-log-limit}")
    private int eventLogLimit;

    @Test
    void startsSessionWithEffectiveSettings() {
        SessionModels.SessionSnapshot session = sessionService.startSession("svc-start", "arithmetic",
                new QuizSettings(2, false, 7));

        assertEquals("arithmetic", session.questionSetName());
        assertEquals(2, session.total());
        assertEquals(0, session.cursor());
        assertTrue(session.active());
        assertEquals(7, session.settings().timerDurationSeconds());
        assertEquals(SessionModels.SessionState.ACTIVE, session.state());

        sessionService.stopSession("svc-start");
    }

    @Test
    void secondStartOnSameChannelConflictsAndLeavesFirstUntouched() {
        sessionService.startSession("svc-conflict", "capitals", null);

        assertThrows(SessionConflictException.class, () -> sessionService.startSession("svc-conflict", "arithmetic", null));

        SessionModels.SessionSnapshot progress = sessionService.getProgress("svc-conflict").orElseThrow();
        assertEquals("capitals", progress.questionSetName());
        assertTrue(progress.active());
        sessionService.stopSession("svc-conflict");
    }

    @Test
    void rejectsUnknownSetAndInvalidOverrides() {
        assertThrows(QuestionSetNotFoundException.class, () -> sessionService.startSession("svc-bad", "missing", null));
        assertThrows(QuestionSetNotFoundException.class, () -> sessionService.startSession("svc-bad", "broken", null));
        assertThrows(ConfigurationException.class,
                () -> sessionService.startSession("svc-bad", "capitals", new QuizSettings(0, false, 5)));
        assertThrows(ConfigurationException.class,
                () -> sessionService.startSession("svc-bad", "capitals", new QuizSettings(null, false, 0)));
        assertTrue(sessionService.getProgress("svc-bad").isEmpty());
    }

    @Test
    void pauseAndResumeAreIdempotent() {
        sessionService.startSession("svc-pause", "capitals", null);

        assertFalse(sessionService.pauseSession("svc-pause").alreadyPaused());
        SessionModels.PauseResult again = sessionService.pauseSession("svc-pause");
        assertTrue(again.alreadyPaused());
        assertTrue(again.session().paused());
        assertEquals(SessionModels.PresentationOutcome.NOT_APPLICABLE, sessionService.presentCurrentQuestion("svc-pause"));

        assertFalse(sessionService.resumeSession("svc-pause").notPaused());
        SessionModels.ResumeResult notPaused = sessionService.resumeSession("svc-pause");
        assertTrue(notPaused.notPaused());
        assertFalse(notPaused.session().paused());

        sessionService.stopSession("svc-pause");
        assertThrows(SessionNotFoundException.class, () -> sessionService.pauseSession("svc-pause"));
        assertThrows(SessionNotFoundException.class, () -> sessionService.resumeSession("svc-pause"));
    }

    @Test
    void stopReturnsSnapshotAndRemovesSession() throws Exception {
        sessionService.startSession("svc-stop", "arithmetic", new QuizSettings(null, false, 30));
        assertEquals(SessionModels.PresentationOutcome.STARTED, sessionService.presentCurrentQuestion("svc-stop"));
        awaitTrue(() -> timers.status("svc-stop").isPresent(), 3000);

        SessionModels.SessionSnapshot stopped = sessionService.stopSession("svc-stop");

        assertFalse(stopped.active());
        assertFalse(stopped.paused());
        assertEquals(0, stopped.cursor());
        assertEquals(5, stopped.total());
        assertEquals(SessionModels.SessionState.STOPPED, stopped.state());
        assertTrue(sessionService.getProgress("svc-stop").isEmpty());
        assertTrue(timers.isReady("svc-stop"));
        assertEquals(stopped, sessionService.lastResult("svc-stop").orElseThrow().snapshot());
        assertThrows(SessionNotFoundException.class, () -> sessionService.stopSession("svc-stop"));

        Thread.sleep(200);
        assertEquals(1, feed.messages("svc-stop").size());
    }

    @Test
    void runsAllQuestionsToCompletion() throws Exception {
        long started = System.currentTimeMillis();
        sessionService.startSession("svc-e2e", "capitals", new QuizSettings(null, false, 1));
        assertEquals(SessionModels.PresentationOutcome.STARTED, sessionService.presentCurrentQuestion("svc-e2e"));
        assertEquals(SessionModels.PresentationOutcome.ALREADY_PRESENTING, sessionService.presentCurrentQuestion("svc-e2e"));

        assertTrue(awaitTrue(() -> sessionService.lastResult("svc-e2e").isPresent(), 10000));
        long elapsed = System.currentTimeMillis() - started;

        SessionModels.SessionSnapshot result = sessionService.lastResult("svc-e2e").orElseThrow().snapshot();
        assertFalse(result.active());
        assertEquals(3, result.cursor());
        assertEquals(SessionModels.SessionState.COMPLETED, result.state());
        assertTrue(sessionService.getProgress("svc-e2e").isEmpty());
        assertTrue(elapsed >= 2900, "finished after " + elapsed + " ms");

        assertTrue(awaitTrue(() -> feed.messages("svc-e2e").size() == 4, 2000));
        List<InMemoryChannelFeed.ChannelMessage> messages = feed.messages("svc-e2e");
        assertTrue(messages.get(0).content().contains("Correct answer: Paris"));
        assertTrue(messages.get(2).content().contains("Correct answer: Ottawa"));
        assertTrue(messages.get(3).content().startsWith("Quiz complete!"));

        List<String> events = sessionService.events("svc-e2e").stream().map(SessionModels.SessionEvent::eventType).toList();
        assertEquals(SessionEventTypes.SESSION_STARTED, events.get(0));
        assertEquals(3, events.stream().filter(SessionEventTypes.ANSWER_REVEALED::equals).count());
        assertEquals(SessionEventTypes.SESSION_COMPLETED, events.get(events.size() - 1));
        assertTrue(events.stream().allMatch(SessionEventTypes.SUPPORTED::contains));
    }

    @Test
    void pausedIntervalIsNotCountedAgainstTheQuestion() throws Exception {
        long started = System.currentTimeMillis();
        sessionService.startSession("svc-paused", "capitals", new QuizSettings(1, false, 2));
        sessionService.presentCurrentQuestion("svc-paused");
        sessionService.pauseSession("svc-paused");

        Thread.sleep(2500);
        SessionModels.SessionSnapshot whilePaused = sessionService.getProgress("svc-paused").orElseThrow();
        assertTrue(whilePaused.active());
        assertTrue(whilePaused.paused());
        assertTrue(sessionService.lastResult("svc-paused").isEmpty());

        sessionService.resumeSession("svc-paused");
        assertTrue(awaitTrue(() -> sessionService.lastResult("svc-paused").isPresent(), 10000));
        long elapsed = System.currentTimeMillis() - started;

        assertTrue(elapsed >= 3400, "finished after " + elapsed + " ms");
        assertEquals(1, sessionService.lastResult("svc-paused").orElseThrow().snapshot().cursor());
    }

    @Test
    void concurrentStartsAdmitExactlyOneSession() throws Exception {
        int threads = 8;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> calls = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                calls.add(callers.submit(() -> {
                    go.await();
                    try {
                        sessionService.startSession("svc-race", "capitals", null);
                        return true;
                    } catch (SessionConflictException e) {
                        return false;
                    }
                }));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> call : calls) {
                if (call.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            callers.shutdownNow();
            sessionService.stopSession("svc-race");
        }
    }

    @Test
    void reportsLiveSessionsAndStatus() {
        sessionService.startSession("svc-status", "capitals", new QuizSettings(null, true, 20));

        assertTrue(sessionService.activeSessions().stream().anyMatch(s -> s.channelKey().equals("svc-status")));
        String summary = sessionService.statusSummary("svc-status");
        assertTrue(summary.startsWith("Quiz: capitals | Progress: 1/3 | Status: Active | Order: Random"), summary);
        assertThrows(SessionNotFoundException.class, () -> sessionService.statusSummary("svc-none"));

        sessionService.stopSession("svc-status");
        assertTrue(sessionService.activeSessions().stream().noneMatch(s -> s.channelKey().equals("svc-status")));
    }

    @Test
    void sweepLeavesLiveSessionsAlone() {
        sessionService.startSession("svc-sweep", "capitals", null);

        sessionService.sweep();

        assertTrue(sessionService.getProgress("svc-sweep").isPresent());
        assertEquals(0, sessionService.errorSummary("svc-sweep").errorCount());
        sessionService.stopSession("svc-sweep");
    }

    @Test
    void sweepTrimsChannelLogs() {
        for (int i = 0; i < 15; i++) {
            eventRepository.saveError("svc-trim", new SessionModels.ChannelError("reveal_answer", "failure " + i, Instant.now()));
        }
        for (int i = 0; i < eventLogLimit + 5; i++) {
            eventRepository.saveEvent(new SessionModels.SessionEvent("svc-trim", SessionEventTypes.QUESTION_PRESENTED, Instant.now(), "index=" + i));
        }

        sessionService.sweep();

        SessionModels.ErrorSummary errors = sessionService.errorSummary("svc-trim");
        assertEquals(10, errors.errorCount());
        assertEquals("failure 14", errors.recentErrors().get(errors.recentErrors().size() - 1).message());
        assertEquals("failure 5", errors.recentErrors().get(0).message());
        List<SessionModels.SessionEvent> events = sessionService.events("svc-trim");
        assertEquals(eventLogLimit, events.size());
        assertEquals("index=5", events.get(0).payload());
    }

    static boolean awaitTrue(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}

package com.herzen.quiz.session;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.EmptyQuestionSetException;
import com.herzen.quiz.presentation.PresentationChannel;
import com.herzen.quiz.presentation.QuestionMessageFormatter;
import com.herzen.quiz.questionset.QuestionSetRepository;
import com.herzen.quiz.repository.SessionEventJdbcRepository;
import com.herzen.quiz.retry.RetryPolicy;
import com.herzen.quiz.selection.QuestionSelector;
import com.herzen.quiz.session.SessionModels.SessionTiming;
import com.herzen.quiz.settings.QuizSettingsStore;
import com.herzen.quiz.timer.TimerModels.CountdownOutcome;
import com.herzen.quiz.timer.TimerModels.TimerTiming;
import com.herzen.quiz.timer.TimerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuizSessionServiceUnitTest {
    private static final TimerTiming TIMING = new TimerTiming(Duration.ofMillis(50), Duration.ofMillis(10), Duration.ofMillis(300));

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final TimerRegistry timers = new TimerRegistry(executor, new RetryPolicy(3, Duration.ofMillis(5)), TIMING);
    private final QuestionSetRepository questionSets = mock(QuestionSetRepository.class);
    private final PresentationChannel channel = mock(PresentationChannel.class);
    private final SessionEventJdbcRepository eventRepository = mock(SessionEventJdbcRepository.class);

    private final QuizSessionService service = newService(3600000L);

    private QuizSessionService newService(long sweepDelayMs) {
        return new QuizSessionService(questionSets,
                new QuizSettingsStore(null, false, 5, 1, 300, 100),
                new QuestionSelector(),
                timers,
                channel,
                new QuestionMessageFormatter(),
                eventRepository,
                RetryPolicy.noRetry(),
                new SessionTiming(Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(10)),
                TIMING,
                executor,
                10,
                200,
                sweepDelayMs);
    }

    @AfterEach
    void tearDown() {
        timers.cancelAll();
        executor.shutdownNow();
    }

    @Test
    void startWithEmptySetIsRejected() {
        when(questionSets.getQuestions("empty")).thenReturn(Optional.of(List.of()));

        assertThrows(EmptyQuestionSetException.class, () -> service.startSession("unit-empty", "empty", null));
        assertTrue(service.getProgress("unit-empty").isEmpty());
    }

    @Test
    void sweepRemovesStoppedSessionAndItsTimer() throws Exception {
        QuizSession lingering = session("unit-linger");
        service.registry().register(lingering);
        CompletableFuture<CountdownOutcome> countdown = timers.startTimer("unit-linger", lingering, 100, r -> {}, () -> {});
        lingering.stop();

        assertEquals(1, service.sweep());

        assertTrue(service.registry().find("unit-linger").isEmpty());
        assertTrue(timers.isReady("unit-linger"));
        assertEquals(CountdownOutcome.CANCELLED, countdown.get(1, TimeUnit.SECONDS));
        verify(eventRepository).trimErrors(10);
        verify(eventRepository).trimEvents(200);
    }

    @Test
    void sweepKeepsTimerOfAnotherSession() throws Exception {
        QuizSession lingering = session("unit-shared");
        service.registry().register(lingering);
        lingering.stop();
        Object successor = new Object();
        CompletableFuture<CountdownOutcome> countdown = timers.startTimer("unit-shared", successor, 100, r -> {}, () -> {});

        assertEquals(1, service.sweep());

        assertFalse(timers.isReady("unit-shared"));
        assertFalse(countdown.isDone());
        verify(channel, never()).forget(anyString());
    }

    @Test
    void sweepForgetsFeedOfChannelWithExpiredResult() throws Exception {
        QuizSessionService shortRetention = newService(0L);
        QuizSession session = session("unit-quiet");
        shortRetention.registry().register(session);
        shortRetention.stopSession("unit-quiet");
        Thread.sleep(5);

        shortRetention.sweep();

        assertTrue(shortRetention.lastResult("unit-quiet").isEmpty());
        verify(channel).forget("unit-quiet");
    }

    @Test
    void completingStoppedSessionChangesNothing() throws Exception {
        QuizSession session = session("unit-late");
        service.registry().register(session);
        service.stopSession("unit-late");

        service.completeSession(session);

        SessionModels.SessionSnapshot result = service.lastResult("unit-late").orElseThrow().snapshot();
        assertEquals(SessionModels.SessionState.STOPPED, result.state());
        assertEquals(0, result.cursor());
        verify(channel, never()).send(anyString(), anyString());
    }

    private static QuizSession session(String key) {
        return new QuizSession(key, "capitals", List.of(new Question("Capital of France?", "Paris", List.of())),
                new QuizSettings(null, false, 5), Instant.now());
    }
}

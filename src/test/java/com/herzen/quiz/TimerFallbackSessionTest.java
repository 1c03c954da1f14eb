package com.herzen.quiz;

import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.presentation.InMemoryChannelFeed;
import com.herzen.quiz.session.QuizSessionService;
import com.herzen.quiz.session.SessionEventTypes;
import com.herzen.quiz.session.SessionModels;
import com.herzen.quiz.timer.TimerConflictException;
import com.herzen.quiz.timer.TimerRegistry;
import com.herzen.quiz.timer.TimerStartException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;

import static com.herzen.quiz.QuizSessionServiceTest.awaitTrue;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@SpringBootTest
class TimerFallbackSessionTest {
    @MockBean
    private TimerRegistry timers;

    @Autowired
    private QuizSessionService sessionService;

    @Autowired
    private InMemoryChannelFeed feed;

    @BeforeEach
    void timerSubsystemDown() {
        when(timers.startTimer(anyString(), any(), anyInt(), any(), any()))
                .thenThrow(new TimerStartException("any", 3, new IllegalStateException("timer pool exhausted")));
        when(timers.isReady(anyString())).thenReturn(true);
        when(timers.cancelTimer(anyString())).thenReturn(true);
        when(timers.cancelTimer(anyString(), any())).thenReturn(true);
    }

    @Test
    void quizStillCompletesWithoutTimers() throws Exception {
        long started = System.currentTimeMillis();
        sessionService.startSession("fallback-1", "capitals", new QuizSettings(null, false, 1));
        sessionService.presentCurrentQuestion("fallback-1");

        assertTrue(awaitTrue(() -> sessionService.lastResult("fallback-1").isPresent(), 10000));
        long elapsed = System.currentTimeMillis() - started;

        SessionModels.SessionSnapshot result = sessionService.lastResult("fallback-1").orElseThrow().snapshot();
        assertEquals(3, result.cursor());
        assertFalse(result.active());
        assertTrue(elapsed >= 2900 && elapsed < 6000, "finished after " + elapsed + " ms");

        assertTrue(awaitTrue(() -> feed.messages("fallback-1").size() == 4, 2000));
        List<String> events = sessionService.events("fallback-1").stream().map(SessionModels.SessionEvent::eventType).toList();
        assertEquals(3, events.stream().filter(SessionEventTypes.TIMER_FALLBACK::equals).count());
        assertEquals(SessionEventTypes.SESSION_COMPLETED, events.get(events.size() - 1));

        List<InMemoryChannelFeed.ChannelMessage> messages = feed.messages("fallback-1");
        assertTrue(messages.get(1).content().contains("Correct answer: Tokyo"));
        assertEquals(3, sessionService.errorSummary("fallback-1").errorCount());
    }

    @Test
    void stopInterruptsFallbackWait() throws Exception {
        sessionService.startSession("fallback-2", "arithmetic", new QuizSettings(null, false, 30));
        sessionService.presentCurrentQuestion("fallback-2");
        assertTrue(awaitTrue(() -> feed.messages("fallback-2").stream()
                .anyMatch(m -> m.content().contains("Timer unavailable")), 3000));

        SessionModels.SessionSnapshot stopped = sessionService.stopSession("fallback-2");

        assertEquals(0, stopped.cursor());
        Thread.sleep(300);
        assertEquals(1, feed.messages("fallback-2").size());
        assertFalse(feed.messages("fallback-2").get(0).content().contains("Correct answer"));
    }

    @Test
    void timerConflictStopsTheSession() throws Exception {
        doThrow(new TimerConflictException("fallback-3")).when(timers).startTimer(anyString(), any(), anyInt(), any(), any());
        sessionService.startSession("fallback-3", "capitals", new QuizSettings(null, false, 1));
        sessionService.presentCurrentQuestion("fallback-3");

        assertTrue(awaitTrue(() -> feed.messages("fallback-3").stream()
                .anyMatch(m -> m.content().equals("Timer error occurred. Quiz has been stopped.")), 3000));

        SessionModels.SessionSnapshot result = sessionService.lastResult("fallback-3").orElseThrow().snapshot();
        assertEquals(SessionModels.SessionState.STOPPED, result.state());
        assertEquals(0, result.cursor());
        List<String> events = sessionService.events("fallback-3").stream().map(SessionModels.SessionEvent::eventType).toList();
        assertTrue(events.contains(SessionEventTypes.SESSION_FAILED));
        assertFalse(events.contains(SessionEventTypes.TIMER_FALLBACK));
        assertEquals(2, feed.messages("fallback-3").size());
    }
}

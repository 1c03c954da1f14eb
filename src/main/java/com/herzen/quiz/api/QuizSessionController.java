package com.herzen.quiz.api;

import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.NotFoundException;
import com.herzen.quiz.error.SessionNotFoundException;
import com.herzen.quiz.session.QuizSessionService;
import com.herzen.quiz.session.SessionModels;
import com.herzen.quiz.settings.QuizSettingsStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class QuizSessionController {
    private final QuizSessionService sessionService;
    private final QuizSettingsStore settingsStore;

    public QuizSessionController(QuizSessionService sessionService, QuizSettingsStore settingsStore) {
        this.sessionService = sessionService;
        this.settingsStore = settingsStore;
    }

    @PostMapping("/{channelKey}/start")
    public ResponseEntity<StartResponse> start(@PathVariable String channelKey, @RequestBody StartRequest request) {
        QuizSettings override = request.settings() == null ? null : request.settings().applyTo(settingsStore.current());
        SessionModels.SessionSnapshot session = sessionService.startSession(channelKey, request.questionSetName(), override);
        SessionModels.PresentationOutcome presentation = sessionService.presentCurrentQuestion(channelKey);
        return ResponseEntity.ok(new StartResponse(session, presentation));
    }

    @PostMapping("/{channelKey}/stop")
    public ResponseEntity<SessionModels.SessionSnapshot> stop(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.stopSession(channelKey));
    }

    @PostMapping("/{channelKey}/pause")
    public ResponseEntity<SessionModels.PauseResult> pause(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.pauseSession(channelKey));
    }

    @PostMapping("/{channelKey}/resume")
    public ResponseEntity<SessionModels.ResumeResult> resume(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.resumeSession(channelKey));
    }

    @GetMapping("/{channelKey}")
    public ResponseEntity<SessionModels.SessionSnapshot> progress(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.getProgress(channelKey)
                .orElseThrow(() -> new SessionNotFoundException(channelKey)));
    }

    @GetMapping("/{channelKey}/summary")
    public ResponseEntity<SummaryResponse> summary(@PathVariable String channelKey) {
        return ResponseEntity.ok(new SummaryResponse(channelKey, sessionService.statusSummary(channelKey)));
    }

    @GetMapping("/{channelKey}/result")
    public ResponseEntity<SessionModels.FinishedSession> result(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.lastResult(channelKey)
                .orElseThrow(() -> new NotFoundException("RESULT_NOT_FOUND", "No finished quiz for channel " + channelKey)));
    }

    @GetMapping("/{channelKey}/errors")
    public ResponseEntity<SessionModels.ErrorSummary> errors(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.errorSummary(channelKey));
    }

    @GetMapping("/{channelKey}/events")
    public ResponseEntity<List<SessionModels.SessionEvent>> events(@PathVariable String channelKey) {
        return ResponseEntity.ok(sessionService.events(channelKey));
    }

    @GetMapping
    public ResponseEntity<List<SessionModels.SessionSnapshot>> active() {
        return ResponseEntity.ok(sessionService.activeSessions());
    }

    public record StartRequest(String questionSetName, SettingsRequest settings) {}

    public record StartResponse(SessionModels.SessionSnapshot session, SessionModels.PresentationOutcome presentation) {}

    public record SummaryResponse(String channelKey, String summary) {}
}

package com.herzen.quiz.api;

import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.settings.QuizSettingsStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {
    private final QuizSettingsStore settingsStore;

    public SettingsController(QuizSettingsStore settingsStore) {
        this.settingsStore = settingsStore;
    }

    @GetMapping
    public ResponseEntity<SettingsResponse> current() {
        return ResponseEntity.ok(response(settingsStore.current()));
    }

    @PutMapping
    public ResponseEntity<SettingsResponse> update(@RequestBody SettingsRequest request) {
        return ResponseEntity.ok(response(settingsStore.update(request.applyTo(settingsStore.current()))));
    }

    @PostMapping("/toggle-random")
    public ResponseEntity<SettingsResponse> toggleRandomOrder() {
        return ResponseEntity.ok(response(settingsStore.toggleRandomOrder()));
    }

    @PostMapping("/reset")
    public ResponseEntity<SettingsResponse> reset() {
        return ResponseEntity.ok(response(settingsStore.reset()));
    }

    private SettingsResponse response(QuizSettings settings) {
        return new SettingsResponse(settings, settingsStore.summary());
    }

    public record SettingsResponse(QuizSettings settings, String summary) {}
}

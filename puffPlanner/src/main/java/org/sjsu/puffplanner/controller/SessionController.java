package org.sjsu.puffplanner.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.model.dto.SessionProgressDto;
import org.sjsu.puffplanner.model.entity.WizardSession;
import org.sjsu.puffplanner.service.QuestionCatalog;
import org.sjsu.puffplanner.service.store.SessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a user's wizard progress, for support tooling.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class SessionController {

    private final SessionStore sessionStore;
    private final QuestionCatalog questionCatalog;

    @GetMapping("/sessions/{userId}")
    public ResponseEntity<SessionProgressDto> getSession(@PathVariable Long userId) {
        log.info("Fetching wizard progress for userId {}", userId);
        return sessionStore.get(userId)
                .map(this::toDto)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private SessionProgressDto toDto(WizardSession session) {
        Map<String, String> answers = new LinkedHashMap<>();
        int answered = Math.min(session.getAnswers().size(), questionCatalog.stepCount());
        for (int i = 0; i < answered; i++) {
            answers.put(questionCatalog.stepAt(i).getKey(), session.getAnswers().get(i));
        }
        int step = session.getCurrentStep();
        String nextPrompt = step >= 0 && step < questionCatalog.stepCount()
                ? questionCatalog.stepAt(step).getPrompt()
                : null;
        return SessionProgressDto.builder()
                .userId(session.getUserId())
                .currentStep(step)
                .totalSteps(questionCatalog.stepCount())
                .nextPrompt(nextPrompt)
                .answers(answers)
                .build();
    }
}

package org.sjsu.puffplanner.service;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.model.QuestionSpec;
import org.sjsu.puffplanner.model.ValidationOutcome;
import org.sjsu.puffplanner.model.WizardEvent;
import org.sjsu.puffplanner.model.WizardReply;
import org.sjsu.puffplanner.model.entity.WizardSession;
import org.sjsu.puffplanner.model.enums.WizardOutcome;
import org.sjsu.puffplanner.service.store.SessionStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * State machine behind the setup wizard.
 * <p>
 * A user is idle when no session is stored, otherwise waiting on {@code session.currentStep}. Each call
 * loads the session, applies one event and writes the result back (or deletes it) before returning.
 * Nothing is cached between calls. {@link org.sjsu.puffplanner.exception.SessionPersistenceException}
 * is propagated untouched so the caller can report the failure; the stored state is then still the
 * last committed one, and the same answer can simply be sent again.
 */
@Service
@Slf4j
public class ConversationEngine {

    static final String NO_SESSION_MESSAGE =
            "There is no setup in progress. Send /setup to start the wizard first.";
    static final String CANCELLED_MESSAGE =
            "Setup cancelled. Send /setup whenever you want to start again.";

    private final QuestionCatalog questionCatalog;
    private final AnswerValidator answerValidator;
    private final SummaryBuilder summaryBuilder;
    private final SessionStore sessionStore;

    public ConversationEngine(QuestionCatalog questionCatalog,
                              AnswerValidator answerValidator,
                              SummaryBuilder summaryBuilder,
                              SessionStore sessionStore) {
        this.questionCatalog = questionCatalog;
        this.answerValidator = answerValidator;
        this.summaryBuilder = summaryBuilder;
        this.sessionStore = sessionStore;
    }

    public WizardReply handle(Long userId, WizardEvent event) {
        log.info("Handling {} event for userId {}", event.getKind(), userId);
        return switch (event.getKind()) {
            case START -> start(userId);
            case CANCEL -> cancel(userId);
            case ANSWER -> answer(userId, event.getText());
        };
    }

    private WizardReply start(Long userId) {
        // Overwrites any run in progress with a single upsert
        sessionStore.put(userId, new WizardSession(userId));
        log.info("Started wizard for userId {}", userId);
        return prompt(0);
    }

    private WizardReply cancel(Long userId) {
        sessionStore.delete(userId);
        log.info("Cancelled wizard for userId {}", userId);
        return new WizardReply(WizardOutcome.CANCELLED, CANCELLED_MESSAGE);
    }

    private WizardReply answer(Long userId, String rawText) {
        Optional<WizardSession> sessionOpt = sessionStore.get(userId);
        if (sessionOpt.isEmpty()) {
            log.info("Answer from userId {} with no wizard running", userId);
            return new WizardReply(WizardOutcome.NO_SESSION, NO_SESSION_MESSAGE);
        }

        WizardSession session = sessionOpt.get();
        if (!isConsistent(session)) {
            log.warn("Discarding corrupt session for userId {}: step={}, answers={}",
                    userId, session.getCurrentStep(), session.getAnswers());
            sessionStore.delete(userId);
            return new WizardReply(WizardOutcome.NO_SESSION, NO_SESSION_MESSAGE);
        }

        int step = session.getCurrentStep();
        QuestionSpec spec = questionCatalog.stepAt(step);
        ValidationOutcome outcome = answerValidator.validate(spec, rawText);
        if (!outcome.isAccepted()) {
            log.info("Rejected answer for step '{}' from userId {}", spec.getKey(), userId);
            return new WizardReply(WizardOutcome.REJECTED, outcome.getReason());
        }

        session.recordAnswer(outcome.getValue());
        if (session.getCurrentStep() < questionCatalog.stepCount()) {
            sessionStore.put(userId, session);
            log.info("Accepted step '{}' for userId {}, moving to step {}", spec.getKey(), userId, session.getCurrentStep());
            return prompt(session.getCurrentStep());
        }

        String summary = summaryBuilder.build(session.getAnswers());
        sessionStore.delete(userId);
        log.info("Wizard completed for userId {}", userId);
        return new WizardReply(WizardOutcome.COMPLETED, summary);
    }

    private WizardReply prompt(int step) {
        return new WizardReply(WizardOutcome.PROMPTED, questionCatalog.stepAt(step).getPrompt());
    }

    private boolean isConsistent(WizardSession session) {
        int step = session.getCurrentStep();
        return step >= 0
                && step < questionCatalog.stepCount()
                && session.getAnswers() != null
                && session.getAnswers().size() == step;
    }
}

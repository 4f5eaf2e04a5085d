package org.sjsu.puffplanner.service.store;

import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.exception.SessionPersistenceException;
import org.sjsu.puffplanner.model.entity.WizardSession;
import org.sjsu.puffplanner.repository.WizardSessionRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link SessionStore} backed by the {@code wizard_session} table. Each operation runs in its own
 * transaction, so commit failures are reported to the caller instead of being lost after return.
 */
@Service
@Slf4j
public class JpaSessionStore implements SessionStore {

    private final WizardSessionRepository wizardSessionRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaSessionStore(WizardSessionRepository wizardSessionRepository,
                           PlatformTransactionManager transactionManager) {
        this.wizardSessionRepository = wizardSessionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<WizardSession> get(Long userId) {
        return inTransaction("load", userId, () ->
                wizardSessionRepository.findByUserId(userId).map(WizardSession::copy));
    }

    @Override
    public void put(Long userId, WizardSession session) {
        if (session == null) {
            throw new IllegalArgumentException("Session cannot be null");
        }
        inTransaction("save", userId, () -> {
            WizardSession row = wizardSessionRepository.findByUserId(userId)
                    .orElseGet(() -> new WizardSession(userId));
            row.setCurrentStep(session.getCurrentStep());
            row.setAnswers(new ArrayList<>(session.getAnswers()));
            WizardSession saved = wizardSessionRepository.saveAndFlush(row);
            log.debug("Saved session ID {} for userId {} at step {}", saved.getId(), userId, saved.getCurrentStep());
            return saved;
        });
    }

    @Override
    public void delete(Long userId) {
        int removed = inTransaction("delete", userId, () -> wizardSessionRepository.deleteByUserId(userId));
        log.debug("Deleted {} session row(s) for userId {}", removed, userId);
    }

    private <T> T inTransaction(String operation, Long userId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("Failed to {} wizard session for userId {}: {}", operation, userId, e.getMessage(), e);
            throw new SessionPersistenceException("Could not " + operation + " session for user " + userId, e);
        }
    }
}

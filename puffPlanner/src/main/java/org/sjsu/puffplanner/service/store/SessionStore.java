package org.sjsu.puffplanner.service.store;

import org.sjsu.puffplanner.model.entity.WizardSession;

import java.util.Optional;

/**
 * Durable per-user storage for in-progress wizard sessions.
 * <p>
 * Every call is atomic on its own. Calls for different users never block each other; calls for the
 * same user are expected to arrive one at a time. Failures surface as
 * {@link org.sjsu.puffplanner.exception.SessionPersistenceException}.
 */
public interface SessionStore {

    /**
     * @return a detached copy of the user's session, or empty when no wizard is running
     */
    Optional<WizardSession> get(Long userId);

    /**
     * Inserts or overwrites the user's session with the step and answers of {@code session}.
     */
    void put(Long userId, WizardSession session);

    /**
     * Removes the user's session. Does nothing when there is none.
     */
    void delete(Long userId);
}

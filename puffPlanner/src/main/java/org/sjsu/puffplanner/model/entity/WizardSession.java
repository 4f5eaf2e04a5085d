package org.sjsu.puffplanner.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-progress setup wizard for one Telegram user. A row exists only while the wizard is running;
 * it is removed on completion or cancellation.
 * <p>
 * {@code answers.get(i)} holds the accepted value for step {@code i}, so {@code answers.size() == currentStep}.
 */
@Entity
@Table(name = "wizard_session")
@Data
@NoArgsConstructor
public class WizardSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId; // Telegram user ID

    @Column(name = "current_step", nullable = false)
    private int currentStep;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "answers")
    private List<String> answers = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // Constructor for a fresh wizard run
    public WizardSession(Long userId) {
        this.userId = userId;
        this.currentStep = 0;
    }

    public void recordAnswer(String value) {
        answers.add(value);
        currentStep = answers.size();
    }

    /**
     * Detached copy, so callers never share an instance with the store.
     */
    public WizardSession copy() {
        WizardSession copy = new WizardSession(userId);
        copy.setId(id);
        copy.setCurrentStep(currentStep);
        copy.setAnswers(answers != null ? new ArrayList<>(answers) : new ArrayList<>());
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}

package org.sjsu.puffplanner.model.enums;

public enum WizardOutcome {
    PROMPTED,   // Session is (now) waiting on a question
    REJECTED,   // Answer failed validation, session untouched
    COMPLETED,  // Last answer accepted, summary sent, session removed
    CANCELLED,  // Session removed on user request
    NO_SESSION  // Answer arrived while no wizard was running
}

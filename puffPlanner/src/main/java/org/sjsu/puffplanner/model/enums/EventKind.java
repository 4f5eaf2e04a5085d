package org.sjsu.puffplanner.model.enums;

public enum EventKind {
    START,  // /setup: (re)start the wizard from the first question
    CANCEL, // /cancel: abort and drop any progress
    ANSWER  // Free text answering the current question
}

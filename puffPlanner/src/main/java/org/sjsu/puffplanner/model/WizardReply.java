package org.sjsu.puffplanner.model;

import lombok.Value;
import org.sjsu.puffplanner.model.enums.WizardOutcome;

/**
 * The single outbound message produced for one inbound event, plus what happened to the session.
 */
@Value
public class WizardReply {
    WizardOutcome outcome;
    String text;
}

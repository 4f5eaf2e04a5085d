package org.sjsu.puffplanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.sjsu.puffplanner.model.enums.EventKind;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WizardEvent {

    EventKind kind;
    String text; // Raw user text, only present for ANSWER

    public static WizardEvent start() {
        return new WizardEvent(EventKind.START, null);
    }

    public static WizardEvent cancel() {
        return new WizardEvent(EventKind.CANCEL, null);
    }

    public static WizardEvent answer(String text) {
        return new WizardEvent(EventKind.ANSWER, text == null ? "" : text);
    }
}

package org.sjsu.puffplanner.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Result of checking one raw answer: either an accepted canonical value or a rejection reason.
 */
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationOutcome {

    private final String value;
    private final String reason;

    public static ValidationOutcome accepted(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Accepted value cannot be null");
        }
        return new ValidationOutcome(value, null);
    }

    public static ValidationOutcome rejected(String reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Rejection reason cannot be null");
        }
        return new ValidationOutcome(null, reason);
    }

    public boolean isAccepted() {
        return value != null;
    }

    public String getValue() {
        if (!isAccepted()) {
            throw new IllegalStateException("Rejected outcome has no value");
        }
        return value;
    }

    public String getReason() {
        if (isAccepted()) {
            throw new IllegalStateException("Accepted outcome has no rejection reason");
        }
        return reason;
    }
}

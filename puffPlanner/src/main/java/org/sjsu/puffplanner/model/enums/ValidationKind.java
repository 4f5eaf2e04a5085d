package org.sjsu.puffplanner.model.enums;

public enum ValidationKind {
    NUMBER_POSITIVE, // Decimal number strictly greater than zero
    CHOICE_OF        // One of the step's configured choices, case-insensitive
}

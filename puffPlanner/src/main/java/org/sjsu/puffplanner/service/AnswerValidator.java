package org.sjsu.puffplanner.service;

import org.sjsu.puffplanner.model.QuestionSpec;
import org.sjsu.puffplanner.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a raw answer against the validation kind of its step. Stateless.
 */
@Component
public class AnswerValidator {

    // Plain decimal only: no exponent, no grouping separators, no locale commas
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public ValidationOutcome validate(QuestionSpec spec, String raw) {
        String input = raw == null ? "" : raw.trim();
        return switch (spec.getValidation()) {
            case NUMBER_POSITIVE -> validatePositiveNumber(spec, input);
            case CHOICE_OF -> validateChoice(spec, input);
        };
    }

    private ValidationOutcome validatePositiveNumber(QuestionSpec spec, String input) {
        if (!DECIMAL_PATTERN.matcher(input).matches()) {
            return ValidationOutcome.rejected(spec.getRejectionMessage());
        }
        BigDecimal number = new BigDecimal(input);
        if (number.signum() <= 0) {
            return ValidationOutcome.rejected(spec.getRejectionMessage());
        }
        return ValidationOutcome.accepted(canonical(number));
    }

    private ValidationOutcome validateChoice(QuestionSpec spec, String input) {
        String normalized = normalize(input);
        if (normalized.isEmpty()) {
            return ValidationOutcome.rejected(spec.getRejectionMessage());
        }
        return spec.getChoices().stream()
                .map(AnswerValidator::normalize)
                .filter(normalized::equals)
                .findFirst()
                .map(ValidationOutcome::accepted)
                .orElseGet(() -> ValidationOutcome.rejected(spec.getRejectionMessage()));
    }

    static String normalize(String choice) {
        return choice.trim().toLowerCase(Locale.ROOT);
    }

    // "20.0" -> "20", "2.50" -> "2.5", "1E+1" -> "10"
    static String canonical(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }
}

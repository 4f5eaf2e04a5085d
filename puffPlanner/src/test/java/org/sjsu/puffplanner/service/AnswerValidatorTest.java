package org.sjsu.puffplanner.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.sjsu.puffplanner.model.ValidationOutcome;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnswerValidatorTest {

    private final AnswerValidator validator = new AnswerValidator();

    @ParameterizedTest
    @CsvSource({
            "20, 20",
            "' 20 ', 20",
            "2.5, 2.5",
            "20.0, 20",
            "0.75, 0.75",
            ".5, 0.5",
            "+7, 7",
            "100, 100"
    })
    void positiveNumber_acceptsIntegerAndFractionalForms(String raw, String expected) {
        ValidationOutcome outcome = validator.validate(TestCatalogs.puffs(), raw);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getValue()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "abc", "12abc", "1e3", "1,5", "NaN", "Infinity", "0", "0.0", "-3", "--1", "."})
    void positiveNumber_rejectsGarbageAndNonPositive(String raw) {
        ValidationOutcome outcome = validator.validate(TestCatalogs.puffs(), raw);

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.getReason()).isEqualTo(TestCatalogs.PUFFS_REJECTION);
    }

    @Test
    void positiveNumber_rejectsNull() {
        assertThat(validator.validate(TestCatalogs.goal(), null).isAccepted()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "percent, percent",
            "'  PERCENT ', percent",
            "Number, number"
    })
    void choice_isTrimmedAndCaseFolded(String raw, String expected) {
        ValidationOutcome outcome = validator.validate(TestCatalogs.method(), raw);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getValue()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"dollars", "", " ", "percentage", "num"})
    void choice_rejectsValuesOutsideTheSet(String raw) {
        ValidationOutcome outcome = validator.validate(TestCatalogs.method(), raw);

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.getReason()).isEqualTo(TestCatalogs.METHOD_REJECTION);
    }

    @Test
    void rejection_neverEchoesTheRawInput() {
        String hostile = "<b>*evil*</b>";

        ValidationOutcome outcome = validator.validate(TestCatalogs.method(), hostile);

        assertThat(outcome.getReason()).doesNotContain(hostile).isEqualTo(TestCatalogs.METHOD_REJECTION);
    }

    @Test
    void outcome_exposesEitherValueOrReason() {
        ValidationOutcome accepted = ValidationOutcome.accepted("20");
        ValidationOutcome rejected = ValidationOutcome.rejected("no");

        assertThatThrownBy(accepted::getReason).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(rejected::getValue).isInstanceOf(IllegalStateException.class);
    }
}

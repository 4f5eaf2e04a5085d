package org.sjsu.puffplanner.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummaryBuilderTest {

    private final SummaryBuilder summaryBuilder = new SummaryBuilder(TestCatalogs.reductionPlan());

    @Test
    void build_listsEveryAnswerUnderItsLabelInStepOrder() {
        String summary = summaryBuilder.build(List.of("20", "percent", "10"));

        assertThat(summary).isEqualTo("""
                ✅ Setup complete:
                • Puffs: 20
                • Method: percent
                • Goal: 10""");
    }

    @Test
    void build_withMissingAnswers_isRejected() {
        assertThatThrownBy(() -> summaryBuilder.build(List.of("20", "percent")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> summaryBuilder.build(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

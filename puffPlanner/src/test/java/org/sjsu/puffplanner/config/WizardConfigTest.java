package org.sjsu.puffplanner.config;

import org.junit.jupiter.api.Test;
import org.sjsu.puffplanner.exception.CatalogConfigurationException;
import org.sjsu.puffplanner.model.QuestionSpec;
import org.sjsu.puffplanner.model.enums.ValidationKind;
import org.sjsu.puffplanner.service.QuestionCatalog;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WizardConfigTest {

    private static WizardProperties.Question question(String key, ValidationKind kind, String... choices) {
        WizardProperties.Question question = new WizardProperties.Question();
        question.setKey(key);
        question.setLabel(key.toUpperCase());
        question.setPrompt(key + "?");
        question.setValidation(kind);
        question.setChoices(List.of(choices));
        return question;
    }

    @Test
    void questionCatalog_numbersStepsInDeclarationOrder() {
        WizardProperties properties = new WizardProperties();
        properties.setQuestions(List.of(
                question("puffs", ValidationKind.NUMBER_POSITIVE),
                question("method", ValidationKind.CHOICE_OF, "number", "percent")));

        QuestionCatalog catalog = new WizardConfig().questionCatalog(properties);

        assertThat(catalog.steps()).extracting(QuestionSpec::getIndex).containsExactly(0, 1);
        assertThat(catalog.stepAt(1).getChoices()).containsExactly("number", "percent");
    }

    @Test
    void missingRejectionMessage_fallsBackToKindSpecificDefault() {
        QuestionSpec number = WizardConfig.toSpec(0, question("goal", ValidationKind.NUMBER_POSITIVE));
        QuestionSpec choice = WizardConfig.toSpec(0, question("method", ValidationKind.CHOICE_OF, "number", "percent"));

        assertThat(number.getRejectionMessage()).contains("greater than zero");
        assertThat(choice.getRejectionMessage()).contains("number, percent");
    }

    @Test
    void configuredRejectionMessage_isKept() {
        WizardProperties.Question q = question("goal", ValidationKind.NUMBER_POSITIVE);
        q.setRejectionMessage("Goal please.");

        assertThat(WizardConfig.toSpec(0, q).getRejectionMessage()).isEqualTo("Goal please.");
    }

    @Test
    void choiceQuestionWithoutChoices_failsAtStartup() {
        WizardProperties properties = new WizardProperties();
        properties.setQuestions(List.of(question("method", ValidationKind.CHOICE_OF)));

        assertThatThrownBy(() -> new WizardConfig().questionCatalog(properties))
                .isInstanceOf(CatalogConfigurationException.class);
    }
}

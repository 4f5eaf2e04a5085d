package org.sjsu.puffplanner.config;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.model.QuestionSpec;
import org.sjsu.puffplanner.model.enums.ValidationKind;
import org.sjsu.puffplanner.service.QuestionCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@Slf4j
public class WizardConfig {

    @Bean
    public QuestionCatalog questionCatalog(WizardProperties wizardProperties) {
        List<WizardProperties.Question> questions = wizardProperties.getQuestions();
        List<QuestionSpec> steps = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            steps.add(toSpec(i, questions.get(i)));
        }
        return new QuestionCatalog(steps);
    }

    static QuestionSpec toSpec(int index, WizardProperties.Question question) {
        List<String> choices = question.getChoices() != null ? List.copyOf(question.getChoices()) : List.of();
        String rejection = question.getRejectionMessage();
        if (rejection == null || rejection.isBlank()) {
            rejection = defaultRejection(question.getValidation(), choices);
            log.debug("No rejection message configured for step '{}', using default", question.getKey());
        }
        return QuestionSpec.builder()
                .index(index)
                .key(question.getKey())
                .label(question.getLabel())
                .prompt(question.getPrompt())
                .validation(question.getValidation())
                .choices(choices)
                .rejectionMessage(rejection)
                .build();
    }

    private static String defaultRejection(ValidationKind kind, List<String> choices) {
        if (kind == ValidationKind.CHOICE_OF) {
            return "Please reply with one of: " + String.join(", ", choices) + ".";
        }
        return "Please send a number greater than zero.";
    }
}

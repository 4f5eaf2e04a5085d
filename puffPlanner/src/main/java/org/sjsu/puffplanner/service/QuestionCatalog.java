package org.sjsu.puffplanner.service;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.exception.CatalogConfigurationException;
import org.sjsu.puffplanner.model.QuestionSpec;
import org.sjsu.puffplanner.model.enums.ValidationKind;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed, ordered list of wizard steps. Built once at startup and read-only afterwards.
 */
@Slf4j
public class QuestionCatalog {

    private final List<QuestionSpec> steps;

    public QuestionCatalog(List<QuestionSpec> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new CatalogConfigurationException("Question catalog must contain at least one step");
        }
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            QuestionSpec step = steps.get(i);
            if (step == null) {
                throw new CatalogConfigurationException("Step at position " + i + " is missing");
            }
            if (step.getIndex() != i) {
                throw new CatalogConfigurationException(
                        "Step indices must be contiguous from 0: expected " + i + " but found " + step.getIndex());
            }
            if (step.getKey() == null || step.getKey().isBlank()) {
                throw new CatalogConfigurationException("Step " + i + " has no key");
            }
            if (!keys.add(step.getKey())) {
                throw new CatalogConfigurationException("Duplicate step key '" + step.getKey() + "'");
            }
            if (step.getPrompt() == null || step.getPrompt().isBlank()) {
                throw new CatalogConfigurationException("Step '" + step.getKey() + "' has no prompt");
            }
            if (step.getLabel() == null || step.getLabel().isBlank()) {
                throw new CatalogConfigurationException("Step '" + step.getKey() + "' has no label");
            }
            if (step.getRejectionMessage() == null || step.getRejectionMessage().isBlank()) {
                throw new CatalogConfigurationException("Step '" + step.getKey() + "' has no rejection message");
            }
            checkValidation(step);
        }
        this.steps = steps.stream().map(QuestionCatalog::frozen).toList();
        log.info("Question catalog ready with {} steps: {}", this.steps.size(),
                this.steps.stream().map(QuestionSpec::getKey).toList());
    }

    private static QuestionSpec frozen(QuestionSpec step) {
        List<String> choices = step.getChoices() != null ? List.copyOf(step.getChoices()) : List.of();
        return step.toBuilder().choices(choices).build();
    }

    private static void checkValidation(QuestionSpec step) {
        if (step.getValidation() == null) {
            throw new CatalogConfigurationException("Step '" + step.getKey() + "' has no validation kind");
        }
        List<String> choices = step.getChoices() != null ? step.getChoices() : List.of();
        switch (step.getValidation()) {
            case NUMBER_POSITIVE -> {
                if (!choices.isEmpty()) {
                    throw new CatalogConfigurationException(
                            "Step '" + step.getKey() + "' is " + ValidationKind.NUMBER_POSITIVE + " but declares choices");
                }
            }
            case CHOICE_OF -> {
                if (choices.isEmpty() || choices.stream().anyMatch(c -> c == null || c.isBlank())) {
                    throw new CatalogConfigurationException(
                            "Step '" + step.getKey() + "' is " + ValidationKind.CHOICE_OF + " but has no usable choices");
                }
            }
            default -> throw new CatalogConfigurationException(
                    "Step '" + step.getKey() + "' uses unsupported validation " + step.getValidation());
        }
    }

    public int stepCount() {
        return steps.size();
    }

    public QuestionSpec stepAt(int index) {
        if (index < 0 || index >= steps.size()) {
            throw new IndexOutOfBoundsException("Step " + index + " is outside [0, " + steps.size() + ")");
        }
        return steps.get(index);
    }

    public List<QuestionSpec> steps() {
        return steps;
    }
}

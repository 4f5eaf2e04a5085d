package org.sjsu.puffplanner.service;

import lombok.RequiredArgsConstructor;
import org.sjsu.puffplanner.model.QuestionSpec;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class SummaryBuilder {

    static final String HEADER = "✅ Setup complete:";

    private final QuestionCatalog questionCatalog;

    /**
     * Renders the confirmation sent once every step has an accepted answer.
     *
     * @param answers accepted values in step order, one per catalog step
     */
    public String build(List<String> answers) {
        if (answers == null || answers.size() != questionCatalog.stepCount()) {
            throw new IllegalArgumentException("Summary needs exactly " + questionCatalog.stepCount()
                    + " answers but got " + (answers == null ? 0 : answers.size()));
        }
        StringBuilder sb = new StringBuilder(HEADER);
        for (int i = 0; i < answers.size(); i++) {
            QuestionSpec step = questionCatalog.stepAt(i);
            sb.append("\n• ").append(step.getLabel()).append(": ").append(answers.get(i));
        }
        return sb.toString();
    }
}

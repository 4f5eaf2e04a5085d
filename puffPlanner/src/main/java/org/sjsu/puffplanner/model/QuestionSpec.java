package org.sjsu.puffplanner.model;

import lombok.Builder;
import lombok.Value;
import org.sjsu.puffplanner.model.enums.ValidationKind;

import java.util.List;

/**
 * One step of the setup wizard. Instances are immutable and owned by the {@code QuestionCatalog}.
 */
@Value
@Builder(toBuilder = true)
public class QuestionSpec {

    int index;
    String key;   // Stable machine name, e.g. "puffs"
    String label; // Shown in the summary, e.g. "Puffs"
    String prompt;
    ValidationKind validation;

    @Builder.Default
    List<String> choices = List.of(); // Only used by CHOICE_OF

    String rejectionMessage; // Fixed reply on a rejected answer, never derived from user input
}

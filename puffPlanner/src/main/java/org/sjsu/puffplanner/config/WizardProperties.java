package org.sjsu.puffplanner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.sjsu.puffplanner.model.enums.ValidationKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code wizard.*} block of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "wizard")
public class WizardProperties {

    @Valid
    @NotEmpty
    private List<Question> questions = new ArrayList<>();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Question {
        @NotBlank
        private String key;
        @NotBlank
        private String label;
        @NotBlank
        private String prompt;
        @NotNull
        private ValidationKind validation;
        private List<String> choices = new ArrayList<>();
        private String rejectionMessage;
    }

    @Data
    public static class Dispatch {
        @Min(1)
        private int lanes = 4;
    }
}

package org.sjsu.puffplanner.model.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class SessionProgressDto {
    private Long userId;
    private Integer currentStep;
    private Integer totalSteps;
    private String nextPrompt;
    private Map<String, String> answers; // Step key -> accepted value, in step order
}

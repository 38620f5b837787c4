package com.opro.optimization.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * One generation of candidates. The prompt list is append-only.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Step {

    private int stepNumber;

    @Builder.Default
    private List<Prompt> prompts = new ArrayList<>();

    @JsonIgnore
    public boolean isComplete() {
        return !prompts.isEmpty() && prompts.stream().allMatch(p -> p.getState() == PromptState.SCORED);
    }

    public List<Prompt> pendingPrompts() {
        return prompts.stream().filter(p -> p.getState() == PromptState.PENDING).toList();
    }
}

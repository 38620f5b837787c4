package com.opro.optimization.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One optimization run. {@code steps.get(i).getStepNumber() == i} and {@code currentStep} always
 * names the last step.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {

    private String id;
    private String name;
    private int currentStep;

    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    private OproConfig config;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public Step getActiveStep() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Session " + id + " has no steps");
        }
        return steps.get(steps.size() - 1);
    }

    public Optional<Prompt> findPrompt(String promptId) {
        return steps.stream()
                .flatMap(step -> step.getPrompts().stream())
                .filter(prompt -> prompt.getId().equals(promptId))
                .findFirst();
    }

    public Optional<Step> findStepOf(String promptId) {
        return steps.stream()
                .filter(step -> step.getPrompts().stream().anyMatch(p -> p.getId().equals(promptId)))
                .findFirst();
    }

    @JsonIgnore
    public List<Prompt> getScoredPrompts() {
        return steps.stream()
                .flatMap(step -> step.getPrompts().stream())
                .filter(prompt -> prompt.getScore() != null)
                .toList();
    }
}

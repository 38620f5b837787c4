package com.opro.optimization.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;

/**
 * A candidate instruction under evaluation. Only {@code state} and {@code score} change after creation.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prompt {

    private String id;
    private String text;
    private PromptState state;
    private Double score;
    private Instant createdAt;

    @JsonIgnore
    public boolean isScored() {
        return state == PromptState.SCORED && score != null;
    }
}

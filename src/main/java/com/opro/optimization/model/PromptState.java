package com.opro.optimization.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PromptState {
    PENDING,
    SCORING,
    SCORED;

    /**
     * pending -> scoring -> scored, plus scoring -> pending when a scoring attempt fails.
     */
    public boolean canTransitionTo(PromptState next) {
        return switch (this) {
            case PENDING -> next == SCORING;
            case SCORING -> next == SCORED || next == PENDING;
            case SCORED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PromptState fromWireName(String value) {
        return PromptState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.opro.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public final class OptimizerRequests {

    private OptimizerRequests() {
    }

    public record Generate(
            @NotBlank(message = "Meta prompt is required and must be a string") String metaPrompt,
            @Min(value = 1, message = "K must be between 1 and 16") @Max(value = 16, message = "K must be between 1 and 16") Integer k,
            Double temperature,
            String model
    ) {
    }

    public record Score(
            @NotBlank(message = "Prompt is required and must be a string") String prompt,
            @NotEmpty(message = "Questions must be a non-empty array") List<@Valid Question> questions,
            Double temperature,
            String model
    ) {
    }

    public record Question(
            @NotBlank(message = "Each question must have a question text") String question,
            @NotNull(message = "Each question must have a goldAnswer") Double goldAnswer
    ) {
    }
}

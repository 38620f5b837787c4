package com.opro.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request bodies of the session endpoints. Unset config fields fall back to {@code opro.defaults}.
 */
public final class SessionRequests {

    private SessionRequests() {
    }

    public record CreateSession(
            String name,
            @Min(1) @Max(16) Integer k,
            @Min(1) Integer topX,
            String optimizerModel,
            @DecimalMin("0.0") @DecimalMax("2.0") Double optimizerTemperature,
            String scorerModel,
            @DecimalMin("0.0") @DecimalMax("2.0") Double scorerTemperature
    ) {
    }

    public record ScoreBatch(@Min(1) Integer batchSize) {
    }

    public record CustomScore(@NotBlank String text) {
    }

    public record AutoRun(@Min(1) @Max(100) int steps) {
    }
}

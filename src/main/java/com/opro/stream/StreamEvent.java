package com.opro.stream;

import java.time.Instant;

public record StreamEvent(
        long id,
        String runId,
        Instant timestamp,
        String type,
        Object data
) {
}

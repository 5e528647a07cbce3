package com.github.dimitryivaniuta.iam.projection.state;

import java.time.OffsetDateTime;

public record FailedEvent(
        String projectionName,
        String instanceId,
        long failedSequence,
        int failureCount,
        String error,
        OffsetDateTime lastFailed
) {}

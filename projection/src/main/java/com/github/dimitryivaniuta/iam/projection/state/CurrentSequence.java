package com.github.dimitryivaniuta.iam.projection.state;

import java.time.OffsetDateTime;

public record CurrentSequence(
        String projectionName,
        String aggregateType,
        String instanceId,
        long sequence,
        OffsetDateTime lastUpdated
) {}

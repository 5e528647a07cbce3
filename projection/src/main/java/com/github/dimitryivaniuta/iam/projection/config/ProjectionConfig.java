package com.github.dimitryivaniuta.iam.projection.config;

import com.github.dimitryivaniuta.iam.projection.handler.RestartPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Resolved settings of a single projection.
 *
 * @see ProjectionProperties#forProjection(String)
 */
@Value
@Builder(toBuilder = true)
public class ProjectionConfig {
    String projectionName;
    Duration requeueEvery;
    Duration retryFailedAfter;
    int retries;
    int maxFailureCount;
    int concurrentInstances;
    int batchConcurrency;
    int bulkLimit;
    Duration handleActiveInstances;
    Duration lockDuration;
    int queueSize;
    @Builder.Default
    RestartPolicy subscriptionRestart = RestartPolicy.never();
}

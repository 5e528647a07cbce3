package com.github.dimitryivaniuta.iam.projection.config;

import com.github.dimitryivaniuta.iam.projection.handler.RestartPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projection engine tunables.
 *
 * YAML prefix: {@code projections}
 *
 * Example:
 * <pre>
 * projections:
 *   requeue-every: 60s
 *   retry-failed-after: 1s
 *   retries: 5
 *   max-failure-count: 5
 *   concurrent-instances: 1
 *   batch-concurrency: 2
 *   bulk-limit: 200
 *   handle-active-instances: 10m   # 0 = every instance on every tick
 *   lock-duration: 60s
 *   subscription-restart:
 *     max-restarts: 3
 *     backoff: 5s
 *   customizations:
 *     "[projections.users]":   # brackets keep the dot in the map key
 *       bulk-limit: 2000
 * </pre>
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "projections")
public class ProjectionProperties {

    /** Interval of the scheduled sweep; the first tick runs right after start. */
    @NotNull
    private Duration requeueEvery = Duration.ofSeconds(60);

    /** Backoff between two update attempts of one process call. */
    @NotNull
    private Duration retryFailedAfter = Duration.ofSeconds(1);

    /** Retries of a partially failed update within one process call. */
    @Min(0)
    private int retries = 5;

    /**
     * Failures of one event after which it is skipped for good. The skip happens on
     * failure {@code maxFailureCount + 1}, so a value of 5 allows six attempts.
     */
    @Min(0)
    private int maxFailureCount = 5;

    /** Instances handled (and locked) together by one sweep batch. */
    @Min(1)
    private int concurrentInstances = 1;

    /** Sweep batches running at the same time. */
    @Min(1)
    private int batchConcurrency = 2;

    /** Max events fetched per round trip. */
    @Min(1)
    private int bulkLimit = 200;

    /**
     * Once the first sweep succeeded, only instances with events newer than
     * {@code now - handleActiveInstances} are swept. Zero disables the restriction.
     */
    @NotNull
    private Duration handleActiveInstances = Duration.ZERO;

    /** TTL of sweep locks; held locks are renewed every half of it. */
    @NotNull
    private Duration lockDuration = Duration.ofSeconds(60);

    /** Capacity of the real-time queue of each subscribed projection. */
    @Min(1)
    private int queueSize = 1000;

    @Valid
    @NotNull
    private Restart subscriptionRestart = new Restart();

    /** Overrides keyed by projection name. */
    @Valid
    @NotNull
    private Map<String, Customization> customizations = new LinkedHashMap<>();

    @Getter
    @Setter
    @ToString
    public static class Restart {
        /** 0 = a failed loop stays down. */
        @Min(0)
        private long maxRestarts = 0;

        @NotNull
        private Duration backoff = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    @ToString
    public static class Customization {
        @Min(1)
        private Integer bulkLimit;
        @Min(0)
        private Integer maxFailureCount;
        private Duration requeueEvery;
        private Duration retryFailedAfter;
    }

    /** Effective settings of one projection: defaults overlaid with its customization. */
    public ProjectionConfig forProjection(String projectionName) {
        ProjectionConfig.ProjectionConfigBuilder b = ProjectionConfig.builder()
                .projectionName(projectionName)
                .requeueEvery(requeueEvery)
                .retryFailedAfter(retryFailedAfter)
                .retries(retries)
                .maxFailureCount(maxFailureCount)
                .concurrentInstances(concurrentInstances)
                .batchConcurrency(batchConcurrency)
                .bulkLimit(bulkLimit)
                .handleActiveInstances(handleActiveInstances)
                .lockDuration(lockDuration)
                .queueSize(queueSize)
                .subscriptionRestart(new RestartPolicy(subscriptionRestart.getMaxRestarts(), subscriptionRestart.getBackoff()));

        Customization c = customizations.get(projectionName);
        if (c != null) {
            if (c.getBulkLimit() != null) b.bulkLimit(c.getBulkLimit());
            if (c.getMaxFailureCount() != null) b.maxFailureCount(c.getMaxFailureCount());
            if (c.getRequeueEvery() != null) b.requeueEvery(c.getRequeueEvery());
            if (c.getRetryFailedAfter() != null) b.retryFailedAfter(c.getRetryFailedAfter());
        }
        return b.build();
    }
}

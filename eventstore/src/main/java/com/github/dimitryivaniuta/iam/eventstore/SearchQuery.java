package com.github.dimitryivaniuta.iam.eventstore;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filter for {@link EventSource} reads. Clauses are OR-combined, the fields of one
 * clause AND-combined; {@code creationDateAfter} applies to every clause.
 *
 * <pre>
 * SearchQuery.builder()
 *     .clause(SearchQuery.Clause.builder().aggregateType("org").instanceId("i1").sequenceGreater(5L).build())
 *     .clause(SearchQuery.Clause.builder().aggregateType("org").instanceId("i2").sequenceGreater(3L).build())
 *     .limit(100)
 *     .build();
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class SearchQuery {

    @Singular
    List<Clause> clauses;

    /** 0 means unlimited. */
    long limit;

    /** Bound reads by the read timestamp of the current call, if one is set. */
    boolean allowTimeTravel;

    OffsetDateTime creationDateAfter;

    @Value
    @Builder(toBuilder = true)
    public static class Clause {
        @Singular
        Set<String> aggregateTypes;
        @Singular
        Set<String> aggregateIds;
        @Singular
        Set<String> eventTypes;
        String instanceId;
        String excludedInstanceId;
        Long sequenceGreater;
        Long sequenceLess;
        /** Payload containment filter (top level keys). */
        @Builder.Default
        Map<String, Object> eventData = Map.of();
    }
}

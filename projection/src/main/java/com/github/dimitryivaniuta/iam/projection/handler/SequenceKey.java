package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.projection.statement.Statement;

/** Aggregate type and instance a current sequence is kept for. */
public record SequenceKey(String aggregateType, String instanceId) {

    public static SequenceKey of(Statement statement) {
        return new SequenceKey(statement.getAggregateType(), statement.getInstanceId());
    }
}

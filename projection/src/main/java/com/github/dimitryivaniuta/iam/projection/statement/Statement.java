package com.github.dimitryivaniuta.iam.projection.statement;

import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Result of reducing one event: the event's identity and ordering data plus the
 * {@link Operation} to apply to the projection.
 */
@Value
public class Statement {
    @NonNull String aggregateType;
    @NonNull String aggregateId;
    @NonNull String instanceId;
    long sequence;
    long previousSequence;
    OffsetDateTime creationDate;
    @NonNull Operation operation;

    public boolean isNoOp() {
        return operation.kind() == Operation.Kind.NO_OP;
    }
}

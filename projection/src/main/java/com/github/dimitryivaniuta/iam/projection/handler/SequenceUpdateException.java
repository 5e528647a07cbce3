package com.github.dimitryivaniuta.iam.projection.handler;

/**
 * Writing a current sequence affected no row. The update call is rolled back.
 */
public class SequenceUpdateException extends RuntimeException {

    public SequenceUpdateException(String projectionName, SequenceKey key, long sequence) {
        super("Current sequence not updated: projection=" + projectionName
                + " aggregateType=" + key.aggregateType()
                + " instance=" + key.instanceId()
                + " sequence=" + sequence);
    }
}

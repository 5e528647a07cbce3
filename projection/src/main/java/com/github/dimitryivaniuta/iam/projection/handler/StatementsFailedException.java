package com.github.dimitryivaniuta.iam.projection.handler;

import lombok.Getter;

/**
 * Some statements failed; everything up to {@link #getLastAppliedIndex()} of the submitted
 * list is committed. {@code -1} means nothing of the list was applied.
 */
@Getter
public class StatementsFailedException extends RuntimeException {

    private final int lastAppliedIndex;

    public StatementsFailedException(String projectionName, int lastAppliedIndex) {
        super("Some statements failed: projection=" + projectionName + " lastAppliedIndex=" + lastAppliedIndex);
        this.lastAppliedIndex = lastAppliedIndex;
    }
}

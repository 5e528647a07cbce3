package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.eventstore.Event;
import lombok.Getter;

/**
 * An event could not be reduced to a statement. Nothing of the call is applied.
 */
@Getter
public class ReductionException extends RuntimeException {

    private final transient Event event;

    public ReductionException(Event event, String message) {
        super(message(event, message));
        this.event = event;
    }

    public ReductionException(Event event, Throwable cause) {
        super(message(event, cause.getMessage()), cause);
        this.event = event;
    }

    private static String message(Event event, String detail) {
        return "Reduce failed: aggregateType=" + event.aggregateType()
                + " eventType=" + event.eventType()
                + " instance=" + event.instanceId()
                + " sequence=" + event.sequence()
                + (detail == null ? "" : ": " + detail);
    }
}

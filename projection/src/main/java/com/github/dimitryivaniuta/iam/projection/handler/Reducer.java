package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;

/**
 * Maps one event to the statement applying it. Must not have side effects;
 * failures are reported by throwing.
 */
@FunctionalInterface
public interface Reducer {

    Statement reduce(Event event);
}

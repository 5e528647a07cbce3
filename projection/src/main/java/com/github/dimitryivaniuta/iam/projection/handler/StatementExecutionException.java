package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import lombok.Getter;

/**
 * The SQL of one statement failed; its savepoint was rolled back.
 */
@Getter
public class StatementExecutionException extends RuntimeException {

    private final transient Statement statement;

    public StatementExecutionException(String projectionName, Statement statement, Throwable cause) {
        super("Statement failed: projection=" + projectionName
                + " aggregateType=" + statement.getAggregateType()
                + " instance=" + statement.getInstanceId()
                + " sequence=" + statement.getSequence(), cause);
        this.statement = statement;
    }
}

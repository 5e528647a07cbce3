package com.github.dimitryivaniuta.iam.projection.statement;

/**
 * Equality predicate of an update or delete; a {@code null} value matches {@code IS NULL}.
 */
public record Condition(String name, Object value) {

    public Condition {
        Identifiers.requireValid(name);
    }
}

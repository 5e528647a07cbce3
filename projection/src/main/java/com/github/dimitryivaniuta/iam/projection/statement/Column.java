package com.github.dimitryivaniuta.iam.projection.statement;

/**
 * Column value written by a create or update. A {@code null} value is written as SQL {@code NULL}.
 */
public record Column(String name, Object value) {

    public Column {
        Identifiers.requireValid(name);
    }
}

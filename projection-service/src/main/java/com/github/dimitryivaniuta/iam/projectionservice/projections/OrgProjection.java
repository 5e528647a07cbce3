package com.github.dimitryivaniuta.iam.projectionservice.projections;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.projection.handler.ProjectionDefinition;
import com.github.dimitryivaniuta.iam.projection.handler.Reducers;
import com.github.dimitryivaniuta.iam.projection.statement.Operation;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import com.github.dimitryivaniuta.iam.projection.statement.Statements;

import java.util.List;

import static com.github.dimitryivaniuta.iam.projection.statement.Statements.col;
import static com.github.dimitryivaniuta.iam.projection.statement.Statements.where;

/**
 * Organizations read model: {@code projections.orgs} and its verified domains in
 * {@code projections.orgs_domains}.
 */
public final class OrgProjection {

    public static final String NAME = "projections.orgs";
    public static final String DOMAINS = "domains";

    public static final String AGGREGATE_TYPE = "org";
    public static final String ADDED = "org.added";
    public static final String CHANGED = "org.changed";
    public static final String REMOVED = "org.removed";
    public static final String DOMAIN_ADDED = "org.domain.added";
    public static final String DOMAIN_REMOVED = "org.domain.removed";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NamePayload(String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DomainPayload(String domain) {}

    private final Payloads payloads;

    public OrgProjection(ObjectMapper objectMapper) {
        this.payloads = new Payloads(objectMapper);
    }

    public ProjectionDefinition definition() {
        return ProjectionDefinition.builder()
                .name(NAME)
                .subTableSuffix(DOMAINS)
                .reducers(Reducers.builder()
                        .on(AGGREGATE_TYPE, ADDED, this::reduceAdded)
                        .on(AGGREGATE_TYPE, CHANGED, this::reduceChanged)
                        .on(AGGREGATE_TYPE, REMOVED, this::reduceRemoved)
                        .on(AGGREGATE_TYPE, DOMAIN_ADDED, this::reduceDomainAdded)
                        .on(AGGREGATE_TYPE, DOMAIN_REMOVED, this::reduceDomainRemoved)
                        .build())
                .build();
    }

    Statement reduceAdded(Event event) {
        NamePayload payload = payloads.read(event, NamePayload.class);
        return Statements.create(event,
                col("id", event.aggregateId()),
                col("instance_id", event.instanceId()),
                col("name", payload.name()),
                col("creation_date", event.creationDate()),
                col("change_date", event.creationDate()),
                col("sequence", event.sequence()));
    }

    Statement reduceChanged(Event event) {
        NamePayload payload = payloads.read(event, NamePayload.class);
        if (payload.name() == null) {
            return Statements.noOp(event);
        }
        return Statements.update(event,
                List.of(
                        col("name", payload.name()),
                        col("change_date", event.creationDate()),
                        col("sequence", event.sequence())),
                List.of(
                        where("id", event.aggregateId()),
                        where("instance_id", event.instanceId())));
    }

    Statement reduceRemoved(Event event) {
        return Statements.multi(event,
                Statements.deleteIn(DOMAINS,
                        where("org_id", event.aggregateId()),
                        where("instance_id", event.instanceId())),
                Statements.deleteIn(null,
                        where("id", event.aggregateId()),
                        where("instance_id", event.instanceId())));
    }

    Statement reduceDomainAdded(Event event) {
        DomainPayload payload = payloads.read(event, DomainPayload.class);
        return Statements.multi(event,
                Statements.createIn(DOMAINS,
                        col("org_id", event.aggregateId()),
                        col("instance_id", event.instanceId()),
                        col("domain", payload.domain()),
                        col("creation_date", event.creationDate())),
                touch(event));
    }

    Statement reduceDomainRemoved(Event event) {
        DomainPayload payload = payloads.read(event, DomainPayload.class);
        return Statements.multi(event,
                Statements.deleteIn(DOMAINS,
                        where("org_id", event.aggregateId()),
                        where("instance_id", event.instanceId()),
                        where("domain", payload.domain())),
                touch(event));
    }

    private static Operation touch(Event event) {
        return Statements.updateIn(null,
                List.of(
                        col("change_date", event.creationDate()),
                        col("sequence", event.sequence())),
                List.of(
                        where("id", event.aggregateId()),
                        where("instance_id", event.instanceId())));
    }
}

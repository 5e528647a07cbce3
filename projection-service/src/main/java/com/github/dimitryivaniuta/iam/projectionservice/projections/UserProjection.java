package com.github.dimitryivaniuta.iam.projectionservice.projections;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.projection.handler.ProjectionDefinition;
import com.github.dimitryivaniuta.iam.projection.handler.Reducers;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import com.github.dimitryivaniuta.iam.projection.statement.Statements;

import java.util.List;

import static com.github.dimitryivaniuta.iam.projection.statement.Statements.col;
import static com.github.dimitryivaniuta.iam.projection.statement.Statements.where;

/**
 * Users read model {@code projections.users}. Users belong to the org that is their
 * resource owner and go away with it.
 */
public final class UserProjection {

    public static final String NAME = "projections.users";

    public static final String AGGREGATE_TYPE = "user";
    public static final String HUMAN_ADDED = "user.human.added";
    public static final String USERNAME_CHANGED = "user.username.changed";
    public static final String REMOVED = "user.removed";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UsernamePayload(String username) {}

    private final Payloads payloads;

    public UserProjection(ObjectMapper objectMapper) {
        this.payloads = new Payloads(objectMapper);
    }

    public ProjectionDefinition definition() {
        return ProjectionDefinition.builder()
                .name(NAME)
                .reducers(Reducers.builder()
                        .on(AGGREGATE_TYPE, HUMAN_ADDED, this::reduceHumanAdded)
                        .on(AGGREGATE_TYPE, USERNAME_CHANGED, this::reduceUsernameChanged)
                        .on(AGGREGATE_TYPE, REMOVED, this::reduceRemoved)
                        .on(OrgProjection.AGGREGATE_TYPE, OrgProjection.REMOVED, this::reduceOrgRemoved)
                        .build())
                .build();
    }

    Statement reduceHumanAdded(Event event) {
        UsernamePayload payload = payloads.read(event, UsernamePayload.class);
        return Statements.create(event,
                col("id", event.aggregateId()),
                col("instance_id", event.instanceId()),
                col("resource_owner", event.resourceOwner()),
                col("username", payload.username()),
                col("creation_date", event.creationDate()),
                col("change_date", event.creationDate()),
                col("sequence", event.sequence()));
    }

    Statement reduceUsernameChanged(Event event) {
        UsernamePayload payload = payloads.read(event, UsernamePayload.class);
        return Statements.update(event,
                List.of(
                        col("username", payload.username()),
                        col("change_date", event.creationDate()),
                        col("sequence", event.sequence())),
                List.of(
                        where("id", event.aggregateId()),
                        where("instance_id", event.instanceId())));
    }

    Statement reduceRemoved(Event event) {
        return Statements.delete(event,
                where("id", event.aggregateId()),
                where("instance_id", event.instanceId()));
    }

    Statement reduceOrgRemoved(Event event) {
        return Statements.delete(event,
                where("resource_owner", event.aggregateId()),
                where("instance_id", event.instanceId()));
    }
}

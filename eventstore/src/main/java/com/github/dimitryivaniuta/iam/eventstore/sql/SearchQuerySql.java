package com.github.dimitryivaniuta.iam.eventstore.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.SearchQuery;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a {@link SearchQuery} into named-parameter SQL for {@code DatabaseClient}.
 */
public final class SearchQuerySql {

    public static final String EVENTS_TABLE = "eventstore.events";

    static final String EVENT_COLUMNS = """
            aggregate_type, aggregate_id, instance_id, resource_owner, event_type,
            event_sequence, previous_aggregate_type_sequence, creation_date, payload""";

    private final ObjectMapper objectMapper;

    public SearchQuerySql(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** SQL plus its bind values. */
    public record Rendered(String sql, Map<String, Object> binds) {}

    public Rendered events(SearchQuery query, OffsetDateTime readTimestamp) {
        Map<String, Object> binds = new LinkedHashMap<>();
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(EVENT_COLUMNS)
                .append(" FROM ").append(EVENTS_TABLE)
                .append(where(query, readTimestamp, binds))
                .append(" ORDER BY event_sequence ASC, aggregate_type ASC");
        // Inline LIMIT (do not bind into LIMIT).
        if (query.getLimit() > 0) {
            sql.append(" LIMIT ").append(query.getLimit());
        }
        return new Rendered(sql.toString(), binds);
    }

    public Rendered instanceIds(SearchQuery query, OffsetDateTime readTimestamp) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String sql = "SELECT DISTINCT instance_id FROM " + EVENTS_TABLE
                + where(query, readTimestamp, binds)
                + " ORDER BY instance_id";
        return new Rendered(sql, binds);
    }

    private String where(SearchQuery query, OffsetDateTime readTimestamp, Map<String, Object> binds) {
        if (query.getClauses().isEmpty()) {
            throw new IllegalArgumentException("search query needs at least one clause");
        }
        List<String> clauses = new ArrayList<>(query.getClauses().size());
        for (SearchQuery.Clause clause : query.getClauses()) {
            List<String> conditions = conditions(clause, binds);
            if (conditions.isEmpty()) {
                throw new IllegalArgumentException("search query clause has no filter");
            }
            clauses.add("( " + String.join(" AND ", conditions) + " )");
        }
        StringBuilder where = new StringBuilder(" WHERE (")
                .append(String.join(" OR ", clauses))
                .append(')');
        if (query.getCreationDateAfter() != null) {
            where.append(" AND creation_date > :").append(bind(binds, query.getCreationDateAfter()));
        }
        if (query.isAllowTimeTravel() && readTimestamp != null) {
            where.append(" AND creation_date <= :").append(bind(binds, readTimestamp));
        }
        return where.toString();
    }

    private List<String> conditions(SearchQuery.Clause clause, Map<String, Object> binds) {
        List<String> conditions = new ArrayList<>();
        in(conditions, binds, "aggregate_type", clause.getAggregateTypes());
        in(conditions, binds, "aggregate_id", clause.getAggregateIds());
        in(conditions, binds, "event_type", clause.getEventTypes());
        if (clause.getInstanceId() != null) {
            conditions.add("instance_id = :" + bind(binds, clause.getInstanceId()));
        }
        if (clause.getExcludedInstanceId() != null) {
            conditions.add("instance_id <> :" + bind(binds, clause.getExcludedInstanceId()));
        }
        if (clause.getSequenceGreater() != null) {
            conditions.add("event_sequence > :" + bind(binds, clause.getSequenceGreater()));
        }
        if (clause.getSequenceLess() != null) {
            conditions.add("event_sequence < :" + bind(binds, clause.getSequenceLess()));
        }
        if (!clause.getEventData().isEmpty()) {
            conditions.add("CAST(payload AS jsonb) @> CAST(:" + bind(binds, toJson(clause.getEventData())) + " AS jsonb)");
        }
        return conditions;
    }

    private static void in(List<String> conditions, Map<String, Object> binds, String column, Set<String> values) {
        if (values.isEmpty()) {
            return;
        }
        if (values.size() == 1) {
            conditions.add(column + " = :" + bind(binds, values.iterator().next()));
            return;
        }
        conditions.add(column + " IN (:" + bind(binds, List.copyOf(values)) + ")");
    }

    private static String bind(Map<String, Object> binds, Object value) {
        String name = "p" + binds.size();
        binds.put(name, value);
        return name;
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event data filter", e);
        }
    }
}

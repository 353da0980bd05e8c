package org.migrata.unit;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Row-level trigger on {@code table}, created only when the table has no trigger of that name.
 * {@code function} names what the trigger calls: a routine on PostgreSQL, a trigger class on H2.
 */
public record EnsureTrigger(String table, String name, String timing, List<String> events, String function)
        implements OperationSpec {

    private static final Set<String> TIMINGS = Set.of("BEFORE", "AFTER", "INSTEAD OF");
    private static final Set<String> EVENTS = Set.of("INSERT", "UPDATE", "DELETE");

    public EnsureTrigger {
        Specs.require(table, "table", "ensureTrigger");
        Specs.require(name, "name", "ensureTrigger");
        Specs.require(function, "function", "ensureTrigger");
        timing = timing == null || timing.isBlank() ? "BEFORE" : timing.trim().toUpperCase(Locale.ROOT);
        if (!TIMINGS.contains(timing)) {
            throw new IllegalArgumentException("ensureTrigger " + name + ": unknown timing '" + timing + "'");
        }
        events = events == null ? List.of() : events.stream().map(e -> e.trim().toUpperCase(Locale.ROOT)).toList();
        if (events.isEmpty()) {
            throw new IllegalArgumentException("ensureTrigger " + name + ": 'events' is required");
        }
        for (String event : events) {
            if (!EVENTS.contains(event)) {
                throw new IllegalArgumentException("ensureTrigger " + name + ": unknown event '" + event + "'");
            }
        }
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureTrigger(this);
    }

    @Override
    public String describe() {
        return "EnsureTrigger " + name + " " + timing + " " + String.join(" OR ", events) + " on " + table;
    }
}

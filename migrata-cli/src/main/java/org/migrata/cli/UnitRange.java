package org.migrata.cli;

import org.migrata.unit.MigrationUnit;

import java.util.List;

/**
 * Inclusive unit id range: {@code N}, {@code N..M}, {@code N..}, {@code ..M}, or everything when empty.
 */
public record UnitRange(Long from, Long to) {

    public static final UnitRange ALL = new UnitRange(null, null);

    public static UnitRange parse(String text) {
        if (text == null || text.isBlank()) {
            return ALL;
        }
        String s = text.trim();
        int dots = s.indexOf("..");
        try {
            if (dots < 0) {
                long id = Long.parseLong(s);
                return new UnitRange(id, id);
            }
            String left = s.substring(0, dots).trim();
            String right = s.substring(dots + 2).trim();
            Long from = left.isEmpty() ? null : Long.parseLong(left);
            Long to = right.isEmpty() ? null : Long.parseLong(right);
            if (from != null && to != null && from > to) {
                throw new IllegalArgumentException("Empty unit range: " + text);
            }
            return new UnitRange(from, to);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid unit range: " + text, e);
        }
    }

    public boolean contains(long id) {
        return (from == null || id >= from) && (to == null || id <= to);
    }

    public List<MigrationUnit> filter(List<MigrationUnit> units) {
        return units.stream().filter(u -> contains(u.id())).toList();
    }
}

package org.migrata.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A type name split into its base ({@code character varying}) and numeric modifiers ({@code [36]}).
 */
public record SqlType(String base, List<Integer> params) {

    public SqlType {
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static SqlType parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Type must not be null");
        }
        String text = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        int open = text.indexOf('(');
        int close = text.indexOf(')', open + 1);
        if (open < 0 || close < 0) {
            return new SqlType(text, List.of());
        }
        List<Integer> params = new ArrayList<>();
        for (String p : text.substring(open + 1, close).split(",")) {
            try {
                params.add(Integer.parseInt(p.trim()));
            } catch (NumberFormatException e) {
                // non-numeric modifiers (e.g. interval fields) keep the raw text as the base
                return new SqlType(text, List.of());
            }
        }
        String base = (text.substring(0, open) + " " + text.substring(close + 1)).trim().replaceAll("\\s+", " ");
        return new SqlType(base, params);
    }

    public SqlType withBase(String newBase) {
        return new SqlType(newBase, params);
    }

    public SqlType withoutParams() {
        return new SqlType(base, List.of());
    }

    public boolean hasParams() {
        return !params.isEmpty();
    }

    public int param(int index, int fallback) {
        return index < params.size() ? params.get(index) : fallback;
    }

    @Override
    public String toString() {
        if (params.isEmpty()) {
            return base;
        }
        StringBuilder sb = new StringBuilder(base).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(params.get(i));
        }
        return sb.append(')').toString();
    }
}

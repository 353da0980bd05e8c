package org.migrata.migration;

import org.migrata.migration.spi.ConversionSafety;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table of type pairs a dialect can convert without losing values.
 * Inputs are expected to be normalized by the owning dialect. Pairs not listed are {@link ConversionSafety#LOSSY}.
 */
public final class ConversionRules {

    private final Map<String, Set<String>> lossless;
    private final Set<String> paddedTypes;
    private final List<Set<String>> families;
    private final Set<String> precisionTypes;
    private final Set<String> universalTargets;
    private final Map<String, String> expressions;

    private ConversionRules(Builder b) {
        this.lossless = Map.copyOf(b.lossless);
        this.paddedTypes = Set.copyOf(b.paddedTypes);
        this.families = List.copyOf(b.families);
        this.precisionTypes = Set.copyOf(b.precisionTypes);
        this.universalTargets = Set.copyOf(b.universalTargets);
        this.expressions = Map.copyOf(b.expressions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConversionSafety evaluate(SqlType from, SqlType to) {
        if (from.equals(to)) {
            return ConversionSafety.IDENTICAL;
        }
        if (from.base().equals(to.base())) {
            return sameBase(from, to);
        }
        // trailing blanks of a padded value are dropped by any cast out of its type
        if (paddedTypes.contains(from.base())) {
            return ConversionSafety.LOSSY;
        }
        if (!to.hasParams() && universalTargets.contains(to.base())) {
            return ConversionSafety.LOSSLESS;
        }
        if (lossless.getOrDefault(from.base(), Set.of()).contains(to.base()) && !to.hasParams()) {
            return ConversionSafety.LOSSLESS;
        }
        return ConversionSafety.LOSSY;
    }

    /**
     * Whether values of the two types can be compared for equality, e.g. by a foreign key.
     * True for the same base type or two types of one declared family, whatever their modifiers.
     */
    public boolean comparable(SqlType a, SqlType b) {
        if (a.base().equals(b.base())) {
            return true;
        }
        return families.stream().anyMatch(f -> f.contains(a.base()) && f.contains(b.base()));
    }

    /**
     * Special conversion template for the pair, with {@code %s} standing for the quoted column.
     */
    public Optional<String> expression(SqlType from, SqlType to, String quotedColumn) {
        String template = expressions.get(from.base() + "->" + to.base());
        return template == null ? Optional.empty() : Optional.of(template.formatted(quotedColumn));
    }

    private ConversionSafety sameBase(SqlType from, SqlType to) {
        if (!to.hasParams()) {
            return ConversionSafety.LOSSLESS;
        }
        if (!from.hasParams()) {
            return ConversionSafety.LOSSY;
        }
        if (precisionTypes.contains(from.base())) {
            int fromScale = from.param(1, 0);
            int toScale = to.param(1, 0);
            boolean integerDigitsFit = to.param(0, 0) - toScale >= from.param(0, 0) - fromScale;
            return integerDigitsFit && toScale >= fromScale ? ConversionSafety.LOSSLESS : ConversionSafety.LOSSY;
        }
        return to.param(0, 0) >= from.param(0, 0) ? ConversionSafety.LOSSLESS : ConversionSafety.LOSSY;
    }

    public static final class Builder {
        private final Map<String, Set<String>> lossless = new HashMap<>();
        private final Set<String> paddedTypes = new HashSet<>();
        private final List<Set<String>> families = new ArrayList<>();
        private final Set<String> precisionTypes = new HashSet<>();
        private final Set<String> universalTargets = new HashSet<>();
        private final Map<String, String> expressions = new HashMap<>();

        private Builder() {}

        public Builder lossless(String from, String... targets) {
            lossless.computeIfAbsent(from, k -> new HashSet<>()).addAll(Set.of(targets));
            return this;
        }

        /**
         * Blank-padded character types. Only a change of length within the same type keeps their values.
         */
        public Builder paddedTypes(String... types) {
            paddedTypes.addAll(Set.of(types));
            return this;
        }

        /**
         * Base types whose values compare with each other.
         */
        public Builder family(String... types) {
            families.add(Set.of(types));
            return this;
        }

        /**
         * Types with (precision, scale) modifiers.
         */
        public Builder precisionTypes(String... types) {
            precisionTypes.addAll(Set.of(types));
            return this;
        }

        /**
         * Unbounded targets that can hold the text form of any value.
         */
        public Builder universalTargets(String... types) {
            universalTargets.addAll(Set.of(types));
            return this;
        }

        public Builder expression(String from, String to, String template) {
            lossless(from, to);
            expressions.put(from + "->" + to, template);
            return this;
        }

        public ConversionRules build() {
            return new ConversionRules(this);
        }
    }
}

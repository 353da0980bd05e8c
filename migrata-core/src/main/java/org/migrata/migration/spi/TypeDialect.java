package org.migrata.migration.spi;

public interface TypeDialect {

    /**
     * Renders a type reported by {@link java.sql.DatabaseMetaData#getColumns} in this dialect's canonical spelling.
     */
    String formatIntrospectedType(String typeName, int columnSize, int decimalDigits);

    /**
     * Canonical spelling of a type written by a unit author ({@code int4} becomes {@code integer}, ...).
     */
    String normalizeType(String declaredType);

    default boolean sameType(String a, String b) {
        return normalizeType(a).equals(normalizeType(b));
    }

    ConversionSafety conversionSafety(String fromType, String toType);

    /**
     * Whether a foreign key may join columns of these types. Modifiers such as lengths are ignored.
     */
    boolean comparableTypes(String a, String b);

    /**
     * Value-preserving expression converting {@code column} from {@code fromType} to {@code toType},
     * or null when the dialect converts implicitly.
     */
    String defaultConversionExpression(String quotedColumn, String fromType, String toType);

    /**
     * Whether {@code ALTER COLUMN ... TYPE} accepts a {@code USING} expression.
     */
    boolean supportsConversionExpression();
}

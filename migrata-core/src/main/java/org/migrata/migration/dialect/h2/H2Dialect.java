package org.migrata.migration.dialect.h2;

import org.migrata.migration.AbstractDialect;
import org.migrata.migration.ConversionRules;
import org.migrata.migration.SqlType;
import org.migrata.migration.spi.IdentifierPolicy;
import org.migrata.unit.EnsureFunction;
import org.migrata.unit.EnsureTrigger;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * H2 2.x. DDL is not transactional in H2: a rolled-back unit keeps the DDL it already executed.
 * Functions are Java source aliases and triggers call a class implementing {@code org.h2.api.Trigger}.
 */
public class H2Dialect extends AbstractDialect {

    public static final String NAME = "h2";

    // H2 reports unbounded character types with this length
    private static final int UNBOUNDED_LENGTH = 1_000_000_000;
    private static final int DEFAULT_NUMERIC_PRECISION = 100_000;

    private static final Map<String, String> ALIASES = Map.ofEntries(
            entry("varchar", "character varying"),
            entry("varchar2", "character varying"),
            entry("nvarchar", "character varying"),
            entry("char", "character"),
            entry("text", "character large object"),
            entry("clob", "character large object"),
            entry("int", "integer"),
            entry("int4", "integer"),
            entry("serial", "integer"),
            entry("int8", "bigint"),
            entry("int2", "smallint"),
            entry("bool", "boolean"),
            entry("double", "double precision"),
            entry("float8", "double precision"),
            entry("float", "double precision"),
            entry("float4", "real"),
            entry("decimal", "numeric"),
            entry("dec", "numeric"),
            entry("jsonb", "json"),
            entry("timestamptz", "timestamp with time zone"),
            entry("timestamp without time zone", "timestamp"),
            entry("time without time zone", "time")
    );

    public H2Dialect() {
        super();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new H2IdentifierPolicy();
    }

    @Override
    protected ConversionRules initializeConversionRules() {
        return ConversionRules.builder()
                .paddedTypes("character")
                .precisionTypes("numeric")
                .universalTargets("character large object", "character varying")
                .family("character varying", "character")
                .family("smallint", "integer", "bigint", "numeric", "real", "double precision")
                .lossless("smallint", "integer", "bigint", "numeric", "real", "double precision")
                .lossless("integer", "bigint", "numeric", "double precision")
                .lossless("bigint", "numeric")
                .lossless("real", "double precision")
                .lossless("date", "timestamp", "timestamp with time zone")
                .lossless("timestamp", "timestamp with time zone")
                .build();
    }

    @Override
    protected String canonicalBase(String base) {
        return ALIASES.getOrDefault(base, base);
    }

    @Override
    protected SqlType canonicalize(SqlType type) {
        String base = type.base();
        if ((base.equals("character varying") || base.equals("character large object"))
                && type.param(0, 0) >= UNBOUNDED_LENGTH) {
            return type.withoutParams();
        }
        if (base.equals("numeric") && type.param(0, 0) >= DEFAULT_NUMERIC_PRECISION) {
            return type.withoutParams();
        }
        return type;
    }

    @Override
    public String formatIntrospectedType(String typeName, int columnSize, int decimalDigits) {
        String base = canonicalBase(typeName.trim().toLowerCase(Locale.ROOT));
        return switch (base) {
            case "character varying", "character" ->
                    columnSize > 0 && columnSize < UNBOUNDED_LENGTH ? base + "(" + columnSize + ")" : base;
            case "numeric" -> columnSize > 0 && columnSize < DEFAULT_NUMERIC_PRECISION
                    ? "numeric(" + columnSize + "," + Math.max(decimalDigits, 0) + ")" : base;
            default -> base;
        };
    }

    @Override
    public boolean supportsConversionExpression() {
        return false;
    }

    @Override
    public String getCreateFunctionSql(EnsureFunction function) {
        return "CREATE ALIAS " + quoteIdentifier(function.name()) + " AS $$ " + function.body() + " $$";
    }

    @Override
    public String getCreateTriggerSql(EnsureTrigger trigger) {
        return "CREATE TRIGGER " + quoteIdentifier(trigger.name()) + " " + trigger.timing() + " "
                + String.join(", ", trigger.events()) + " ON " + quoteIdentifier(trigger.table())
                + " FOR EACH ROW CALL '" + trigger.function().replace("'", "''") + "'";
    }
}

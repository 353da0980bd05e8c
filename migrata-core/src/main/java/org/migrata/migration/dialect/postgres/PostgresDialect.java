package org.migrata.migration.dialect.postgres;

import org.migrata.migration.AbstractDialect;
import org.migrata.migration.ConversionRules;
import org.migrata.migration.SqlType;
import org.migrata.migration.spi.IdentifierPolicy;
import org.migrata.unit.EnsureFunction;
import org.migrata.unit.EnsureTrigger;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

public class PostgresDialect extends AbstractDialect {

    public static final String NAME = "postgresql";

    // pgjdbc reports unbounded varchar with this length
    private static final int UNBOUNDED_LENGTH = Integer.MAX_VALUE;
    private static final int MAX_NUMERIC_PRECISION = 1000;

    private static final Map<String, String> ALIASES = Map.ofEntries(
            entry("int", "integer"),
            entry("int4", "integer"),
            entry("serial", "integer"),
            entry("serial4", "integer"),
            entry("int8", "bigint"),
            entry("bigserial", "bigint"),
            entry("serial8", "bigint"),
            entry("int2", "smallint"),
            entry("smallserial", "smallint"),
            entry("serial2", "smallint"),
            entry("bool", "boolean"),
            entry("varchar", "character varying"),
            entry("char", "character"),
            entry("bpchar", "character"),
            entry("float8", "double precision"),
            entry("double", "double precision"),
            entry("float", "double precision"),
            entry("float4", "real"),
            entry("decimal", "numeric"),
            entry("timestamp without time zone", "timestamp"),
            entry("timestamp with time zone", "timestamptz"),
            entry("time without time zone", "time"),
            entry("time with time zone", "timetz")
    );

    public PostgresDialect() {
        super();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new PostgresIdentifierPolicy();
    }

    @Override
    protected ConversionRules initializeConversionRules() {
        return ConversionRules.builder()
                .paddedTypes("character")
                .precisionTypes("numeric")
                .universalTargets("text", "character varying")
                .family("character varying", "character", "text")
                .family("smallint", "integer", "bigint", "numeric", "real", "double precision")
                .family("date", "timestamp", "timestamptz")
                .lossless("smallint", "integer", "bigint", "numeric", "real", "double precision")
                .lossless("integer", "bigint", "numeric", "double precision")
                .lossless("bigint", "numeric")
                .lossless("real", "double precision")
                .lossless("date", "timestamp", "timestamptz")
                .lossless("timestamp", "timestamptz")
                .lossless("time", "timetz")
                .lossless("json", "jsonb")
                .expression("text", "jsonb", "to_jsonb(%s)")
                .expression("character varying", "jsonb", "to_jsonb(%s)")
                .build();
    }

    @Override
    protected String canonicalBase(String base) {
        return ALIASES.getOrDefault(base, base);
    }

    @Override
    protected SqlType canonicalize(SqlType type) {
        if (type.base().equals("character varying") && type.param(0, 0) == UNBOUNDED_LENGTH) {
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
            case "numeric" -> columnSize > 0 && columnSize <= MAX_NUMERIC_PRECISION
                    ? "numeric(" + columnSize + "," + Math.max(decimalDigits, 0) + ")" : base;
            default -> base;
        };
    }

    @Override
    public boolean supportsConversionExpression() {
        return true;
    }

    @Override
    public String getCreateFunctionSql(EnsureFunction function) {
        String tag = function.body().contains("$$") ? "$migrata$" : "$$";
        return "CREATE FUNCTION " + quoteIdentifier(function.name()) + "() RETURNS " + function.returns()
                + " AS " + tag + function.body() + tag + " LANGUAGE " + function.language();
    }

    @Override
    public String getCreateTriggerSql(EnsureTrigger trigger) {
        return "CREATE TRIGGER " + quoteIdentifier(trigger.name()) + " " + trigger.timing() + " "
                + String.join(" OR ", trigger.events()) + " ON " + quoteIdentifier(trigger.table())
                + " FOR EACH ROW EXECUTE FUNCTION " + quoteIdentifier(trigger.function()) + "()";
    }
}

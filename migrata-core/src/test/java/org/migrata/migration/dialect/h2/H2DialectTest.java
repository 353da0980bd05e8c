package org.migrata.migration.dialect.h2;

import org.migrata.migration.spi.ConversionSafety;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class H2DialectTest {

    private final H2Dialect dialect = new H2Dialect();

    @Test
    @DisplayName("H2가 보고하는 무제한 길이는 길이 없는 타입으로 정규화된다")
    void unboundedLengthsAreDropped() {
        assertThat(dialect.formatIntrospectedType("CHARACTER VARYING", 1_000_000_000, 0)).isEqualTo("character varying");
        assertThat(dialect.formatIntrospectedType("CHARACTER VARYING", 36, 0)).isEqualTo("character varying(36)");
        assertThat(dialect.formatIntrospectedType("NUMERIC", 100_000, 0)).isEqualTo("numeric");
        assertThat(dialect.formatIntrospectedType("NUMERIC", 12, 2)).isEqualTo("numeric(12,2)");
        assertThat(dialect.formatIntrospectedType("UUID", 16, 0)).isEqualTo("uuid");
    }

    @Test
    void postgresSpellingsMapOntoH2Types() {
        assertThat(dialect.normalizeType("text")).isEqualTo("character large object");
        assertThat(dialect.normalizeType("jsonb")).isEqualTo("json");
        assertThat(dialect.normalizeType("timestamptz")).isEqualTo("timestamp with time zone");
        assertThat(dialect.sameType("varchar(36)", "CHARACTER VARYING(36)")).isTrue();
    }

    @Test
    @DisplayName("H2는 USING 절을 지원하지 않으므로 변환식을 만들지 않는다")
    void noConversionExpressions() {
        assertThat(dialect.supportsConversionExpression()).isFalse();
        assertThat(dialect.defaultConversionExpression("\"id\"", "varchar(36)", "uuid")).isNull();
        assertThat(dialect.getAlterColumnTypeSql("accounts", "id", "uuid", "\"id\"::uuid"))
                .isEqualTo("ALTER TABLE \"accounts\" ALTER COLUMN \"id\" SET DATA TYPE uuid");
    }

    @Test
    void conversionSafety() {
        assertThat(dialect.conversionSafety("varchar(36)", "uuid")).isEqualTo(ConversionSafety.LOSSY);
        assertThat(dialect.conversionSafety("integer", "bigint")).isEqualTo(ConversionSafety.LOSSLESS);
        assertThat(dialect.conversionSafety("varchar(36)", "varchar(64)")).isEqualTo(ConversionSafety.LOSSLESS);
        assertThat(dialect.conversionSafety("uuid", "text")).isEqualTo(ConversionSafety.LOSSLESS);
    }
}

package org.migrata.migration.spi;

public interface IdentifierPolicy {
    int  maxLength();                      // 63 for PostgreSQL, 256 for H2
    String quote(String raw);              // "foo"
    String normalizeCase(String raw);      // unquoted identifiers fold to lower case
    boolean isKeyword(String raw);         // 예약어 확인
}

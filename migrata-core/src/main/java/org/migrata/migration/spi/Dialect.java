package org.migrata.migration.spi;

public interface Dialect extends BaseDialect, TypeDialect, DdlDialect {
}

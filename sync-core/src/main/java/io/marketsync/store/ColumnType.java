package io.marketsync.store;

/** Logical column types; each {@link SqlDialect} renders them as concrete SQL. */
public enum ColumnType {
    DATE,
    TIMESTAMP,
    BIGINT,
    DOUBLE,
    DECIMAL,
    VARCHAR_32,
    VARCHAR_64,
    VARCHAR_255,
    TEXT
}

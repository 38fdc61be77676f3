package io.marketsync.store;

import io.marketsync.core.WriteMode;

import java.util.Collections;
import java.util.List;

/**
 * Embedded H2, used by tests. Expects the database to run with {@code MODE=MySQL} so that
 * {@code INSERT IGNORE} is understood; upserts use H2's own {@code MERGE ... KEY}.
 */
public class H2Dialect implements SqlDialect {
    @Override
    public String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String typeName(ColumnType type) {
        switch (type) {
            case DATE: return "DATE";
            case TIMESTAMP: return "TIMESTAMP";
            case BIGINT: return "BIGINT";
            case DOUBLE: return "DOUBLE PRECISION";
            case DECIMAL: return "DECIMAL(24,2)";
            case VARCHAR_32: return "VARCHAR(32)";
            case VARCHAR_64: return "VARCHAR(64)";
            case VARCHAR_255: return "VARCHAR(255)";
            default: return "CHARACTER LARGE OBJECT";
        }
    }

    @Override
    public String insertSql(String table, List<String> columns, List<String> primaryKeys, WriteMode mode) {
        String values = String.join(", ", Collections.nCopies(columns.size(), "?"));
        if (mode == WriteMode.IGNORE) {
            return "INSERT IGNORE INTO " + quote(table) + " (" + quoteAll(columns) + ") VALUES (" + values + ")";
        }
        return "MERGE INTO " + quote(table) + " (" + quoteAll(columns) + ") KEY (" + quoteAll(primaryKeys) + ")"
                + " VALUES (" + values + ")";
    }

    @Override
    public String deleteChunkSql(String table, String column, int chunkRows) {
        return "DELETE FROM " + quote(table) + " WHERE " + quote(column) + " < ? FETCH FIRST " + chunkRows + " ROWS ONLY";
    }
}

package io.marketsync.store;

import io.marketsync.core.WriteMode;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** MySQL and TiDB. */
public class MySqlDialect implements SqlDialect {
    @Override
    public String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String typeName(ColumnType type) {
        switch (type) {
            case DATE: return "DATE";
            case TIMESTAMP: return "DATETIME";
            case BIGINT: return "BIGINT";
            case DOUBLE: return "DOUBLE";
            case DECIMAL: return "DECIMAL(24,2)";
            case VARCHAR_32: return "VARCHAR(32)";
            case VARCHAR_64: return "VARCHAR(64)";
            case VARCHAR_255: return "VARCHAR(255)";
            default: return "TEXT";
        }
    }

    @Override
    public String insertSql(String table, List<String> columns, List<String> primaryKeys, WriteMode mode) {
        String values = String.join(", ", Collections.nCopies(columns.size(), "?"));
        List<String> updates = columns.stream().filter(c -> !primaryKeys.contains(c)).collect(Collectors.toList());
        if (mode == WriteMode.IGNORE || updates.isEmpty()) {
            return "INSERT IGNORE INTO " + quote(table) + " (" + quoteAll(columns) + ") VALUES (" + values + ")";
        }
        String set = updates.stream().map(c -> quote(c) + " = VALUES(" + quote(c) + ")").collect(Collectors.joining(", "));
        return "INSERT INTO " + quote(table) + " (" + quoteAll(columns) + ") VALUES (" + values + ")"
                + " ON DUPLICATE KEY UPDATE " + set;
    }

    @Override
    public String deleteChunkSql(String table, String column, int chunkRows) {
        return "DELETE FROM " + quote(table) + " WHERE " + quote(column) + " < ? LIMIT " + chunkRows;
    }

    @Override
    public String tableOptions() { return " DEFAULT CHARSET=utf8mb4"; }
}

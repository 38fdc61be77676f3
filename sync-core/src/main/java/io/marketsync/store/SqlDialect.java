package io.marketsync.store;

import io.marketsync.core.WriteMode;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The SQL that differs between the production store (MySQL protocol) and the embedded one used in tests.
 */
public interface SqlDialect {
    String quote(String identifier);

    String typeName(ColumnType type);

    /** One-row parameterized statement, bound once per row and batched. */
    String insertSql(String table, List<String> columns, List<String> primaryKeys, WriteMode mode);

    /** Deletes at most {@code chunkRows} rows whose {@code column} is below the single bound parameter. */
    String deleteChunkSql(String table, String column, int chunkRows);

    default String tableOptions() { return ""; }

    default String createTableSql(String table, Map<String, ColumnType> columns, List<String> primaryKeys) {
        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(quote(table)).append(" (");
        for (Map.Entry<String, ColumnType> e : columns.entrySet()) {
            sb.append(quote(e.getKey())).append(' ').append(typeName(e.getValue()));
            if (primaryKeys.contains(e.getKey())) sb.append(" NOT NULL");
            sb.append(", ");
        }
        sb.append("PRIMARY KEY (").append(quoteAll(primaryKeys)).append("))");
        return sb.append(tableOptions()).toString();
    }

    default String addColumnSql(String table, String column, ColumnType type) {
        return "ALTER TABLE " + quote(table) + " ADD COLUMN " + quote(column) + " " + typeName(type);
    }

    default String createIndexSql(String table, String indexName, List<String> columns) {
        return "CREATE INDEX " + quote(indexName) + " ON " + quote(table) + " (" + quoteAll(columns) + ")";
    }

    default String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quote).collect(Collectors.joining(", "));
    }

    static SqlDialect forUrl(String jdbcUrl) {
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:h2:")) return new H2Dialect();
        return new MySqlDialect();
    }
}

package io.marketsync.store;

import io.marketsync.core.Row;
import io.marketsync.core.WriteMode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage helpers the sync engines write through: create-if-missing tables, additive schema
 * growth, primary-key writes and chunked retention deletes.
 */
public interface RelationalStore {
    boolean tableExists(String table);

    /** Creates the table when missing, otherwise adds any columns it lacks. */
    EnsureTableResult ensureTable(String table, Map<String, ColumnType> columns, List<String> primaryKeys);

    /** Adds the observed columns the table lacks; never drops or retypes. Returns the added names. */
    List<String> reconcileSchema(String table, Map<String, ColumnType> observed);

    /** Writes rows in statement batches; creates/extends the table first. Returns rows affected. */
    long write(String table, List<Row> rows, List<String> primaryKeys, WriteMode mode);

    /** Deletes rows with {@code column < cutoff}, {@code chunkRows} per statement, at most {@code maxLoops} statements. */
    long deleteOlderThan(String table, String column, Object cutoff, int chunkRows, int maxLoops);

    /** Creates a secondary index when no index of that name exists. Returns true if created. */
    boolean ensureIndex(String table, String indexName, List<String> columns);

    Optional<LocalDateTime> maxTimestamp(String table, String column);

    Optional<LocalDate> maxDate(String table, String column);

    List<String> distinctValues(String table, String column);

    record EnsureTableResult(boolean created, List<String> addedColumns) {}
}

package io.marketsync.store;

import io.marketsync.core.Row;
import io.marketsync.core.Rows;
import io.marketsync.core.WriteMode;
import io.marketsync.error.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class JdbcRelationalStore implements RelationalStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcRelationalStore.class);

    public static final int DEFAULT_WRITE_CHUNK = 2000;

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final int writeChunkRows;

    public JdbcRelationalStore(DataSource dataSource, SqlDialect dialect) {
        this(dataSource, dialect, DEFAULT_WRITE_CHUNK);
    }

    public JdbcRelationalStore(DataSource dataSource, SqlDialect dialect, int writeChunkRows) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.writeChunkRows = Math.max(1, writeChunkRows);
    }

    public DataSource dataSource() { return dataSource; }
    public SqlDialect dialect() { return dialect; }

    @Override
    public boolean tableExists(String table) {
        try (Connection c = dataSource.getConnection()) {
            return tableExists(c, table);
        } catch (SQLException e) {
            throw new SyncException("cannot inspect table " + table, e);
        }
    }

    @Override
    public EnsureTableResult ensureTable(String table, Map<String, ColumnType> columns, List<String> primaryKeys) {
        for (String pk : primaryKeys) {
            if (!columns.containsKey(pk)) {
                throw new IllegalArgumentException("primary key column `" + pk + "` missing from rows for `" + table + "`");
            }
        }
        try (Connection c = dataSource.getConnection()) {
            if (!tableExists(c, table)) {
                try (Statement st = c.createStatement()) {
                    st.execute(dialect.createTableSql(table, columns, primaryKeys));
                }
                log.info("created table {} ({} columns)", table, columns.size());
                return new EnsureTableResult(true, List.of());
            }
            return new EnsureTableResult(false, addMissingColumns(c, table, columns));
        } catch (SQLException e) {
            throw new SyncException("cannot ensure table " + table, e);
        }
    }

    @Override
    public List<String> reconcileSchema(String table, Map<String, ColumnType> observed) {
        try (Connection c = dataSource.getConnection()) {
            return addMissingColumns(c, table, observed);
        } catch (SQLException e) {
            throw new SyncException("cannot reconcile schema of " + table, e);
        }
    }

    private List<String> addMissingColumns(Connection c, String table, Map<String, ColumnType> observed) throws SQLException {
        Set<String> existing = columnNames(c, table);
        List<String> added = new ArrayList<>();
        for (Map.Entry<String, ColumnType> e : observed.entrySet()) {
            if (existing.contains(e.getKey().toLowerCase(Locale.ROOT))) continue;
            try (Statement st = c.createStatement()) {
                st.execute(dialect.addColumnSql(table, e.getKey(), e.getValue()));
            }
            added.add(e.getKey());
        }
        if (!added.isEmpty()) log.info("added columns to {}: {}", table, added);
        return added;
    }

    @Override
    public long write(String table, List<Row> rows, List<String> primaryKeys, WriteMode mode) {
        if (Rows.isEmpty(rows)) return 0;
        List<String> columns = Rows.columns(rows);
        LinkedHashMap<String, ColumnType> schema = ColumnTypes.infer(rows, columns);
        ensureTable(table, schema, primaryKeys);

        String sql = dialect.insertSql(table, columns, primaryKeys, mode);
        long affected = 0;
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (int from = 0; from < rows.size(); from += writeChunkRows) {
                    List<Row> chunk = rows.subList(from, Math.min(rows.size(), from + writeChunkRows));
                    for (Row r : chunk) {
                        for (int i = 0; i < columns.size(); i++) {
                            ps.setObject(i + 1, r.get(columns.get(i)));
                        }
                        ps.addBatch();
                    }
                    for (int n : ps.executeBatch()) {
                        affected += n == Statement.SUCCESS_NO_INFO ? 1 : Math.max(0, n);
                    }
                    c.commit();
                }
            } catch (SQLException e) {
                try {
                    c.rollback();
                } catch (SQLException re) {
                    e.addSuppressed(re);
                }
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new SyncException("write to " + table + " failed", e);
        }
        return affected;
    }

    @Override
    public long deleteOlderThan(String table, String column, Object cutoff, int chunkRows, int maxLoops) {
        String sql = dialect.deleteChunkSql(table, column, chunkRows);
        long total = 0;
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int loop = 0; loop < maxLoops; loop++) {
                ps.setObject(1, cutoff);
                int n = ps.executeUpdate();
                if (!c.getAutoCommit()) c.commit();
                total += n;
                if (n <= 0) break;
            }
        } catch (SQLException e) {
            throw new SyncException("delete from " + table + " where " + column + " < " + cutoff + " failed", e);
        }
        return total;
    }

    @Override
    public boolean ensureIndex(String table, String indexName, List<String> columns) {
        try (Connection c = dataSource.getConnection()) {
            DatabaseMetaData md = c.getMetaData();
            try (ResultSet rs = md.getIndexInfo(c.getCatalog(), null, metaName(md, table), false, false)) {
                while (rs.next()) {
                    String name = rs.getString("INDEX_NAME");
                    if (name != null && name.equalsIgnoreCase(indexName)) return false;
                }
            }
            try (Statement st = c.createStatement()) {
                st.execute(dialect.createIndexSql(table, indexName, columns));
            }
            log.info("created index {} on {}{}", indexName, table, columns);
            return true;
        } catch (SQLException e) {
            throw new SyncException("cannot create index " + indexName + " on " + table, e);
        }
    }

    @Override
    public Optional<LocalDateTime> maxTimestamp(String table, String column) {
        return queryMax(table, column, LocalDateTime.class);
    }

    @Override
    public Optional<LocalDate> maxDate(String table, String column) {
        return queryMax(table, column, LocalDate.class);
    }

    private <T> Optional<T> queryMax(String table, String column, Class<T> type) {
        if (!tableExists(table)) return Optional.empty();
        String sql = "SELECT MAX(" + dialect.quote(column) + ") FROM " + dialect.quote(table);
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) return Optional.empty();
            return Optional.ofNullable(rs.getObject(1, type));
        } catch (SQLException e) {
            throw new SyncException("cannot read max(" + column + ") of " + table, e);
        }
    }

    @Override
    public List<String> distinctValues(String table, String column) {
        String q = dialect.quote(column);
        String sql = "SELECT DISTINCT " + q + " FROM " + dialect.quote(table) + " WHERE " + q + " IS NOT NULL ORDER BY " + q;
        List<String> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                String v = rs.getString(1);
                if (v != null && !v.isBlank()) out.add(v.trim());
            }
        } catch (SQLException e) {
            throw new SyncException("cannot list " + column + " of " + table, e);
        }
        return out;
    }

    private static boolean tableExists(Connection c, String table) throws SQLException {
        DatabaseMetaData md = c.getMetaData();
        try (ResultSet rs = md.getTables(c.getCatalog(), null, metaName(md, table), null)) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) return true;
            }
        }
        return false;
    }

    private static Set<String> columnNames(Connection c, String table) throws SQLException {
        DatabaseMetaData md = c.getMetaData();
        Set<String> names = new HashSet<>();
        try (ResultSet rs = md.getColumns(c.getCatalog(), null, metaName(md, table), null)) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    names.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
        }
        return names;
    }

    /** Table names go into metadata patterns, where '_' is a wildcard and case follows the database. */
    private static String metaName(DatabaseMetaData md, String table) throws SQLException {
        String name = table;
        if (md.storesUpperCaseIdentifiers()) name = name.toUpperCase(Locale.ROOT);
        else if (md.storesLowerCaseIdentifiers()) name = name.toLowerCase(Locale.ROOT);
        return name;
    }
}

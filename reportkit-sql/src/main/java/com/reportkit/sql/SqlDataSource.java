package com.reportkit.sql;

import com.reportkit.core.exception.DataSourceException;
import com.reportkit.core.model.TabularData;
import com.reportkit.core.parser.QueryResultParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC backed source of report data. Holds one connection for its lifetime.
 */
public class SqlDataSource implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SqlDataSource.class);

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final String jdbcUrl;
    private final Connection connection;

    public SqlDataSource(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
        this.connection = open(jdbcUrl);
    }

    public SqlDataSource(Connection connection) {
        this.jdbcUrl = null;
        this.connection = connection;
    }

    private static Connection open(String jdbcUrl) {
        try {
            if (jdbcUrl.startsWith(SQLITE_PREFIX)) {
                // Load SQLite JDBC driver
                Class.forName("org.sqlite.JDBC");
            }
            Connection connection = DriverManager.getConnection(jdbcUrl);
            logger.info("Connected to {}", jdbcUrl);
            return connection;
        } catch (ClassNotFoundException e) {
            throw new DataSourceException("SQLite JDBC driver not found", e);
        } catch (SQLException e) {
            throw new DataSourceException("Failed to connect to " + jdbcUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Run a query and convert its result. Parameters are bound in order.
     */
    public TabularData query(String sql, Object... params) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            bind(pstmt, params);
            try (ResultSet rs = pstmt.executeQuery()) {
                TabularData data = read(rs);
                logger.debug("Query returned {} row(s) in {} column(s)", data.getRowCount(), data.getColumnCount());
                return data;
            }
        } catch (SQLException e) {
            throw new DataSourceException("Query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Execute a statement that returns no rows.
     *
     * @return update count
     */
    public int update(String sql, Object... params) {
        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            bind(pstmt, params);
            return pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DataSourceException("Statement failed: " + e.getMessage(), e);
        }
    }

    /**
     * Convert the remaining rows of a result set. Columns are named by their
     * labels; SQL NULL becomes an empty cell.
     */
    public static TabularData read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }

        return new QueryResultParser().parse(columns, rows);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    private void bind(PreparedStatement pstmt, Object[] params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            pstmt.setObject(i + 1, params[i]);
        }
    }

    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("Connection closed");
            }
        } catch (SQLException e) {
            logger.error("Failed to close connection", e);
        }
    }
}

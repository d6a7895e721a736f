package com.sqljudge.service;

import com.sqljudge.config.JudgeProperties;
import com.sqljudge.exception.QueryException;
import com.sqljudge.store.EphemeralStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the candidate query once and captures every row keyed by output column label.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryRunner {

    private final JudgeProperties properties;
    private final ScheduledExecutorService queryTimeoutScheduler;

    public List<Map<String, Object>> run(EphemeralStore store, String query) {
        int timeoutSeconds = properties.getQueryTimeoutSeconds();

        try (Statement stmt = store.connection().createStatement()) {
            AtomicBoolean timedOut = new AtomicBoolean(false);
            ScheduledFuture<?> canceller = timeoutSeconds > 0
                    ? queryTimeoutScheduler.schedule(() -> cancel(stmt, timedOut), timeoutSeconds, TimeUnit.SECONDS)
                    : null;

            try {
                if (!stmt.execute(query)) {
                    throw new QueryException("Query did not return a result set");
                }
                try (ResultSet rs = stmt.getResultSet()) {
                    return readRows(rs);
                }
            } catch (SQLException e) {
                if (timedOut.get()) {
                    throw new QueryException("Query exceeded time limit of " + timeoutSeconds + "s", e);
                }
                throw new QueryException(e.getMessage(), e);
            } finally {
                if (canceller != null) canceller.cancel(false);
            }
        } catch (SQLException e) {
            throw new QueryException(e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int colCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();

        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= colCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private void cancel(Statement stmt, AtomicBoolean timedOut) {
        timedOut.set(true);
        try {
            stmt.cancel();
            log.warn("Query cancelled after {}s", properties.getQueryTimeoutSeconds());
        } catch (SQLException e) {
            log.warn("Failed to cancel query: {}", e.getMessage());
        }
    }
}

package com.sqljudge.service;

import com.sqljudge.exception.LoadException;
import com.sqljudge.store.EphemeralStore;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Inserts a fixture's input rows into the materialized tables.
 */
@Component
public class FixtureLoader {

    public void load(EphemeralStore store, Map<String, List<Map<String, Object>>> inputData) {
        if (inputData == null) return;

        for (Map.Entry<String, List<Map<String, Object>>> entry : inputData.entrySet()) {
            List<Map<String, Object>> rows = entry.getValue();
            if (rows == null || rows.isEmpty()) continue;

            for (Map<String, Object> row : rows) {
                insertRow(store, entry.getKey(), row);
            }
        }
    }

    // Rows may carry different column sets, so each row gets its own column list.
    private void insertRow(EphemeralStore store, String tableName, Map<String, Object> row) {
        if (row == null || row.isEmpty()) {
            throw new LoadException("Row for table '" + tableName + "' has no columns");
        }

        List<String> columns = new ArrayList<>(row.keySet());
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        String insertSql = "INSERT INTO " + tableName + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";

        try (PreparedStatement stmt = store.connection().prepareStatement(insertSql)) {
            for (int i = 0; i < columns.size(); i++) {
                stmt.setObject(i + 1, toBindable(row.get(columns.get(i))));
            }
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new LoadException(e.getMessage(), e);
        }
    }

    /** Values the driver cannot bind natively are passed as text and cast by the store. */
    private Object toBindable(Object value) {
        if (value instanceof BigInteger || value instanceof Temporal || value instanceof java.util.Date) {
            return value.toString();
        }
        return value;
    }
}

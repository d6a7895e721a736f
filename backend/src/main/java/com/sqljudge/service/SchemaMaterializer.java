package com.sqljudge.service;

import com.sqljudge.dto.ColumnSpec;
import com.sqljudge.dto.SchemaDefinition;
import com.sqljudge.dto.TableSpec;
import com.sqljudge.exception.SchemaException;
import com.sqljudge.store.EphemeralStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the declared tables, empty, in a fresh store.
 */
@Component
@Slf4j
public class SchemaMaterializer {

    public void materialize(EphemeralStore store, SchemaDefinition schema) {
        for (TableSpec table : schema.getTables()) {
            String createTableSql = buildCreateTableSql(table);
            try (Statement stmt = store.connection().createStatement()) {
                stmt.execute(createTableSql);
            } catch (SQLException e) {
                throw new SchemaException(e.getMessage(), e);
            }
            log.trace("Created table: {}", createTableSql);
        }
    }

    /**
     * Typed entries become column clauses; untyped entries are table-level constraint
     * clauses and are emitted verbatim after every column clause.
     */
    public String buildCreateTableSql(TableSpec table) {
        List<String> columnDefs = new ArrayList<>();
        List<String> constraints = new ArrayList<>();

        for (ColumnSpec col : table.getColumns()) {
            if (col.isTableConstraint()) {
                if (col.getName() != null) constraints.add(col.getName());
                continue;
            }

            String colDef = col.getName() + " " + col.getType();
            if (col.getConstraints() != null && !col.getConstraints().isBlank()) {
                colDef += " " + col.getConstraints();
            }
            columnDefs.add(colDef);
        }

        List<String> allDefs = new ArrayList<>(columnDefs);
        allDefs.addAll(constraints);
        return "CREATE TABLE " + table.getName() + " (" + String.join(", ", allDefs) + ")";
    }
}

package com.sqljudge.store;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A private in-memory database used for exactly one evaluation and discarded afterwards.
 * Closing the connection drops every table and row it holds.
 */
@Slf4j
public class EphemeralStore implements AutoCloseable {

    private final Connection connection;
    private final long openedAt;

    EphemeralStore(Connection connection) {
        this.connection = connection;
        this.openedAt = System.currentTimeMillis();
    }

    public Connection connection() {
        return connection;
    }

    public boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.trace("Store closed after {} ms", System.currentTimeMillis() - openedAt);
        } catch (SQLException e) {
            log.warn("Failed to close store: {}", e.getMessage());
        }
    }
}

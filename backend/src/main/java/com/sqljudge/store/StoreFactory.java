package com.sqljudge.store;

import com.sqljudge.config.JudgeProperties;
import com.sqljudge.exception.EvaluationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a fresh, isolated store per call. Stores are never pooled or shared.
 */
@Component
@RequiredArgsConstructor
public class StoreFactory {

    private final JudgeProperties properties;

    public EphemeralStore open() {
        JudgeProperties.Store config = properties.getStore();
        Properties info = new Properties();
        info.setProperty("threads", String.valueOf(config.getThreads()));

        try {
            Connection conn = DriverManager.getConnection(config.getUrl(), info);
            return new EphemeralStore(conn);
        } catch (SQLException e) {
            throw new EvaluationException("Failed to open store: " + e.getMessage(), e);
        }
    }
}

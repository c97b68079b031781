package com.browserpilot.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link TaskStateStore}.
 * <p>
 * Each suspended session is one row holding the JSON-serialized {@link SessionRecord},
 * keyed by session id. The table {@code browser_pilot_session} is created by
 * {@link #createTables()}.
 */
public class JdbcTaskStateStore implements TaskStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStateStore.class);

    private static final String TABLE_NAME = "browser_pilot_session";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id  VARCHAR(64) PRIMARY KEY,
                record      JSONB NOT NULL,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (session_id, record)
            VALUES (?, ?::jsonb)
            ON CONFLICT (session_id)
            DO UPDATE SET record = EXCLUDED.record,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT record::text AS record FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_IDS_SQL = """
            SELECT session_id FROM %s ORDER BY session_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcTaskStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Session table '{}' ensured", TABLE_NAME);
        } catch (SQLException e) {
            throw new TaskStateStoreException("Failed to create table " + TABLE_NAME, e);
        }
    }

    @Override
    public void save(String sessionId, SessionRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setString(2, SessionJson.write(record));
            stmt.executeUpdate();
            log.debug("Saved session '{}'", sessionId);
        } catch (SQLException e) {
            throw new TaskStateStoreException("Failed to save session " + sessionId, e);
        }
    }

    @Override
    public Optional<SessionRecord> load(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(SessionJson.read(rs.getString("record")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskStateStoreException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public void delete(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, sessionId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} row(s) for session '{}'", deleted, sessionId);
        } catch (SQLException e) {
            throw new TaskStateStoreException("Failed to delete session " + sessionId, e);
        }
    }

    @Override
    public List<String> listSessionIds() {
        var ids = new ArrayList<String>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("session_id"));
            }
        } catch (SQLException e) {
            throw new TaskStateStoreException("Failed to list sessions", e);
        }
        return ids;
    }
}

package com.rolebridge.database.sync;

import com.rolebridge.identity.IdentityEvent;
import com.rolebridge.identity.IdentityEventSerializer;
import com.rolebridge.sync.PendingEvent;
import com.rolebridge.sync.PendingEventStore;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link PendingEventStore} backed by the {@code rolebridge_pending_event} table (migration V2).
 *
 * <p>Events are stored as JSON so a queued event survives restarts and replays exactly as it was
 * delivered.
 */
public class JdbcPendingEventStore implements PendingEventStore {

    static final String UPSERT = """
            INSERT INTO rolebridge_pending_event
                   (event_id, identity_key, event_type, payload, attempts, last_error, queued_at, last_attempt_at)
            VALUES (?, ?, ?, ?, 1, ?, now(), now())
            ON CONFLICT (event_id) DO UPDATE
               SET payload = EXCLUDED.payload,
                   attempts = rolebridge_pending_event.attempts + 1,
                   last_error = EXCLUDED.last_error,
                   last_attempt_at = now()
            """;

    static final String DELETE = "DELETE FROM rolebridge_pending_event WHERE event_id = ?";

    static final String SELECT_ALL =
            "SELECT payload, attempts, last_error, queued_at FROM rolebridge_pending_event ORDER BY seq";

    static final String SELECT_FOR_IDENTITY = "SELECT payload, attempts, last_error, queued_at"
            + " FROM rolebridge_pending_event WHERE identity_key = ? ORDER BY seq";

    static final String COUNT = "SELECT count(*) FROM rolebridge_pending_event";

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbc;

    public JdbcPendingEventStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void enqueue(IdentityEvent event, String reason) {
        jdbc.update(UPSERT,
                event.eventId(),
                event.identityKey(),
                event.type().value(),
                IdentityEventSerializer.serialize(event),
                truncate(reason));
    }

    @Override
    public boolean remove(String eventId) {
        return jdbc.update(DELETE, eventId) > 0;
    }

    @Override
    public List<PendingEvent> pending() {
        return jdbc.query(SELECT_ALL, PENDING_MAPPER);
    }

    @Override
    public List<PendingEvent> pendingFor(String identityKey) {
        return jdbc.query(SELECT_FOR_IDENTITY, PENDING_MAPPER, identityKey);
    }

    @Override
    public int size() {
        Integer count = jdbc.queryForObject(COUNT, Integer.class);
        return count == null ? 0 : count;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_ERROR_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_ERROR_LENGTH);
    }

    static final RowMapper<PendingEvent> PENDING_MAPPER = (ResultSet rs, int rowNum) -> mapRow(rs);

    private static PendingEvent mapRow(ResultSet rs) throws SQLException {
        Timestamp queuedAt = rs.getTimestamp("queued_at");
        return new PendingEvent(
                IdentityEventSerializer.deserialize(rs.getString("payload")),
                rs.getInt("attempts"),
                rs.getString("last_error"),
                queuedAt == null ? null : queuedAt.toInstant());
    }
}

package com.chatrelay.server.store.jdbc;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.model.EventSummary;
import com.chatrelay.server.store.EventStore;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

@Repository
public class JdbcEventStore extends JdbcDao implements EventStore {

    private static final String SELECT_EVENT = "SELECT id, creator_id FROM events WHERE id = ?";

    private static final String CAN_ACCESS =
            "SELECT 1 FROM events e WHERE e.id = ? AND (e.creator_id = ? OR EXISTS " +
                    "(SELECT 1 FROM event_participants ep WHERE ep.event_id = e.id AND ep.user_id = ?))";

    private static final String IS_PARTICIPANT =
            "SELECT 1 FROM event_participants WHERE event_id = ? AND user_id = ?";

    private static final String UPDATE_STATUS =
            "UPDATE event_participants SET status = ? WHERE event_id = ? AND user_id = ?";

    public JdbcEventStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public Optional<EventSummary> findEvent(String eventId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_EVENT)) {
            setUuid(ps, 1, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new EventSummary(rs.getString(1), rs.getString(2)));
            }
        } catch (SQLException e) {
            throw new StoreException("Event lookup failed for " + eventId, e);
        }
    }

    @Override
    public boolean canAccessEvent(String userId, String eventId) {
        return exists(CAN_ACCESS, eventId, userId, userId);
    }

    @Override
    public boolean isParticipant(String userId, String eventId) {
        return exists(IS_PARTICIPANT, eventId, userId);
    }

    @Override
    public void updateParticipantStatus(String eventId, String userId, String status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_STATUS)) {
            ps.setString(1, status);
            setUuid(ps, 2, eventId);
            setUuid(ps, 3, userId);
            if (ps.executeUpdate() == 0) {
                throw new RealtimeException(ErrorCode.NOT_PARTICIPANT, "You are not a participant of this event");
            }
        } catch (SQLException e) {
            throw new StoreException("Event status update failed for " + eventId, e);
        }
    }
}

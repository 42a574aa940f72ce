package com.chatrelay.server.store.jdbc;

import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.model.TaskSnapshot;
import com.chatrelay.server.store.TaskStore;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

@Repository
public class JdbcTaskStore extends JdbcDao implements TaskStore {

    private static final String CAN_ACCESS =
            "SELECT 1 FROM tasks WHERE id = ? AND (creator_id = ? OR assignee_id = ?)";

    private static final String SELECT_TASK =
            "SELECT id, title, status, created_at, updated_at FROM tasks WHERE id = ?";

    public JdbcTaskStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public boolean canAccessTask(String userId, String taskId) {
        return exists(CAN_ACCESS, taskId, userId, userId);
    }

    @Override
    public Optional<TaskSnapshot> findTask(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_TASK)) {
            setUuid(ps, 1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new TaskSnapshot(
                        rs.getString("id"),
                        rs.getString("title"),
                        rs.getString("status"),
                        iso(rs.getTimestamp("created_at")),
                        iso(rs.getTimestamp("updated_at"))));
            }
        } catch (SQLException e) {
            throw new StoreException("Task lookup failed for " + taskId, e);
        }
    }
}

package com.chatrelay.server.store.jdbc;

import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.store.UserDirectory;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcUserDirectory extends JdbcDao implements UserDirectory {

    private static final String SELECT_DETAILS =
            "SELECT u.username, ua.file_path FROM users u " +
                    "LEFT JOIN user_avatars ua ON ua.user_id = u.id WHERE u.id = ?";

    private static final String UPDATE_ONLINE =
            "UPDATE users SET is_online = ?, updated_at = ? WHERE id = ?";

    private static final String SELECT_ONLINE = "SELECT is_online FROM users WHERE id = ?";

    private static final String SELECT_CONTACTS = "SELECT contact_id FROM contacts WHERE user_id = ?";

    private final Clock clock;

    public JdbcUserDirectory(DataSource dataSource, Clock clock) {
        super(dataSource);
        this.clock = clock;
    }

    @Override
    public Optional<UserDetails> findUserDetails(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_DETAILS)) {
            setUuid(ps, 1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new UserDetails(rs.getString(1), rs.getString(2)));
            }
        } catch (SQLException e) {
            throw new StoreException("User lookup failed for " + userId, e);
        }
    }

    @Override
    public void setOnlineStatus(String userId, boolean online) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_ONLINE)) {
            ps.setBoolean(1, online);
            ps.setTimestamp(2, timestamp(clock.instant()));
            setUuid(ps, 3, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Online status update failed for " + userId, e);
        }
    }

    @Override
    public boolean isOnline(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_ONLINE)) {
            setUuid(ps, 1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Online status lookup failed for " + userId, e);
        }
    }

    @Override
    public List<String> findContactIds(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_CONTACTS)) {
            setUuid(ps, 1, userId);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Contact lookup failed for " + userId, e);
        }
    }
}

package com.chatrelay.server.store.jdbc;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.model.ConversationKind;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.EditedMessage;
import com.chatrelay.server.model.FileAttachment;
import com.chatrelay.server.model.HydratedMessage;
import com.chatrelay.server.model.NewMessage;
import com.chatrelay.server.model.ReadReceipt;
import com.chatrelay.server.model.StoredMessage;
import com.chatrelay.server.store.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Data Access Object for dialogs, groups and their messages
 */
@Repository
public class JdbcConversationStore extends JdbcDao implements ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcConversationStore.class);

    static final int REPLY_PREVIEW_LENGTH = 50;
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String SELECT_USERNAME = "SELECT username FROM users WHERE id = ?";

    private static final String INSERT_MESSAGE =
            "INSERT INTO messages (id, dialog_id, group_id, sender_id, sender_username, content, " +
                    "replied_to_message_id, is_edited, is_forwarded, forwarded_from_username, created_at, updated_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?, ?, ?)";

    private static final String LINK_FILE =
            "UPDATE files SET message_id = ? WHERE id = ? AND message_id IS NULL";

    private static final String INSERT_MENTION =
            "INSERT INTO message_mentions (message_id, user_id) VALUES (?, ?)";

    private static final String INSERT_READ =
            "INSERT INTO message_reads (message_id, user_id, read_at) VALUES (?, ?, ?)";

    private static final String SELECT_HYDRATED =
            "SELECT m.id, m.dialog_id, m.group_id, m.sender_id, m.sender_username, m.content, m.created_at, " +
                    "m.is_edited, m.is_forwarded, m.forwarded_from_username, m.replied_to_message_id, " +
                    "ua.file_path AS sender_avatar, r.sender_username AS replied_sender, r.content AS replied_content " +
                    "FROM messages m " +
                    "LEFT JOIN user_avatars ua ON ua.user_id = m.sender_id " +
                    "LEFT JOIN messages r ON r.id = m.replied_to_message_id " +
                    "WHERE m.id = ?";

    private static final String SELECT_FILES =
            "SELECT id, file_name, file_path, file_type, file_size FROM files WHERE message_id = ? " +
                    "ORDER BY created_at, id";

    private static final String SELECT_READS =
            "SELECT mr.user_id, u.username, mr.read_at FROM message_reads mr " +
                    "JOIN users u ON u.id = mr.user_id WHERE mr.message_id = ? ORDER BY mr.read_at";

    private static final String SELECT_MESSAGE =
            "SELECT id, dialog_id, group_id, sender_id, sender_username, content FROM messages WHERE id = ?";

    private static final String UPDATE_CONTENT =
            "UPDATE messages SET content = ?, is_edited = TRUE, updated_at = ? WHERE id = ?";

    private static final String DELETE_MESSAGE = "DELETE FROM messages WHERE id = ?";

    private static final String SELECT_READ_MARK =
            "SELECT 1 FROM message_reads WHERE message_id = ? AND user_id = ?";

    private final Clock clock;

    public JdbcConversationStore(DataSource dataSource, Clock clock) {
        super(dataSource);
        this.clock = clock;
    }

    @Override
    public boolean isParticipant(String userId, ConversationTarget target) {
        ConversationKind kind = target.kind();
        return exists("SELECT 1 FROM " + kind.participantTable() + " WHERE " + kind.idColumn() + " = ? AND user_id = ?",
                target.id(), userId);
    }

    @Override
    public List<String> findParticipantIds(ConversationTarget target) {
        ConversationKind kind = target.kind();
        String sql = "SELECT user_id FROM " + kind.participantTable() + " WHERE " + kind.idColumn() + " = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setUuid(ps, 1, target.id());
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Participant lookup failed for " + target, e);
        }
    }

    @Override
    public boolean messageExistsIn(String messageId, ConversationTarget target) {
        return exists("SELECT 1 FROM messages WHERE id = ? AND " + target.kind().idColumn() + " = ?",
                messageId, target.id());
    }

    @Override
    public HydratedMessage createMessage(NewMessage message) {
        String messageId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        return inTransaction("Create message", conn -> {
            String senderName = username(conn, message.senderId());
            insertMessage(conn, messageId, message.target(), message.senderId(), senderName,
                    message.content(), message.repliedToMessageId(), false, null, now);

            // 1. attach uploaded files, each at most once
            try (PreparedStatement ps = conn.prepareStatement(LINK_FILE)) {
                for (String fileId : message.fileIds()) {
                    setUuid(ps, 1, messageId);
                    setUuid(ps, 2, fileId);
                    if (ps.executeUpdate() == 0) {
                        throw new RealtimeException(ErrorCode.FILE_NOT_FOUND,
                                "File not found or already attached: " + fileId);
                    }
                }
            }

            // 2. mentions
            try (PreparedStatement ps = conn.prepareStatement(INSERT_MENTION)) {
                for (String mentioned : message.mentions()) {
                    setUuid(ps, 1, messageId);
                    setUuid(ps, 2, mentioned);
                    ps.addBatch();
                }
                if (!message.mentions().isEmpty()) ps.executeBatch();
            }

            // 3. the sender has read their own message
            insertReadMark(conn, messageId, message.senderId(), now);

            return hydrate(conn, messageId);
        });
    }

    @Override
    public Optional<StoredMessage> findMessage(String messageId) {
        try (Connection conn = dataSource.getConnection()) {
            return findMessage(conn, messageId);
        } catch (SQLException e) {
            throw new StoreException("Message lookup failed for " + messageId, e);
        }
    }

    @Override
    public EditedMessage updateMessageContent(String messageId, String content) {
        Instant now = clock.instant();
        return inTransaction("Edit message", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(UPDATE_CONTENT)) {
                ps.setString(1, content);
                ps.setTimestamp(2, timestamp(now));
                setUuid(ps, 3, messageId);
                if (ps.executeUpdate() == 0) {
                    throw new RealtimeException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found");
                }
            }
            StoredMessage stored = findMessage(conn, messageId)
                    .orElseThrow(() -> new RealtimeException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found"));
            return new EditedMessage(stored.id(), stored.target(), stored.senderId(), stored.content(), now.toString());
        });
    }

    @Override
    public void deleteMessage(String messageId) {
        inTransaction("Delete message", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(DELETE_MESSAGE)) {
                setUuid(ps, 1, messageId);
                if (ps.executeUpdate() == 0) {
                    throw new RealtimeException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found");
                }
            }
            return null;
        });
    }

    /**
     * Each mark is its own statement in auto-commit mode; a concurrent mark from another
     * device of the same user hits the primary key and is treated as already read.
     */
    @Override
    public List<String> markRead(String userId, ConversationTarget target, List<String> messageIds) {
        String belongs = "SELECT 1 FROM messages WHERE id = ? AND " + target.kind().idColumn() + " = ?";
        Instant now = clock.instant();
        List<String> marked = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement inConversation = conn.prepareStatement(belongs);
             PreparedStatement alreadyRead = conn.prepareStatement(SELECT_READ_MARK);
             PreparedStatement insert = conn.prepareStatement(INSERT_READ)) {
            for (String messageId : messageIds) {
                setUuid(inConversation, 1, messageId);
                setUuid(inConversation, 2, target.id());
                try (ResultSet rs = inConversation.executeQuery()) {
                    if (!rs.next()) continue;
                }
                marked.add(messageId);

                setUuid(alreadyRead, 1, messageId);
                setUuid(alreadyRead, 2, userId);
                try (ResultSet rs = alreadyRead.executeQuery()) {
                    if (rs.next()) continue;
                }
                setUuid(insert, 1, messageId);
                setUuid(insert, 2, userId);
                insert.setTimestamp(3, timestamp(now));
                try {
                    insert.executeUpdate();
                } catch (SQLException e) {
                    if (!UNIQUE_VIOLATION.equals(e.getSQLState())) throw e;
                    log.debug("Read mark raced message={} user={}", messageId, userId);
                }
            }
            return marked;
        } catch (SQLException e) {
            throw new StoreException("Mark read failed for " + target, e);
        }
    }

    @Override
    public HydratedMessage forwardMessage(StoredMessage source, ConversationTarget target, String senderId) {
        String messageId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        return inTransaction("Forward message", conn -> {
            String senderName = username(conn, senderId);
            insertMessage(conn, messageId, target, senderId, senderName, source.content(), null,
                    true, source.senderUsername(), now);
            copyFiles(conn, source.id(), messageId, now);
            insertReadMark(conn, messageId, senderId, now);
            return hydrate(conn, messageId);
        });
    }

    private void insertMessage(Connection conn, String id, ConversationTarget target, String senderId,
                               String senderName, String content, String repliedTo,
                               boolean forwarded, String forwardedFrom, Instant now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_MESSAGE)) {
            setUuid(ps, 1, id);
            setUuid(ps, 2, target.dialogId());
            setUuid(ps, 3, target.groupId());
            setUuid(ps, 4, senderId);
            ps.setString(5, senderName);
            ps.setString(6, content);
            setUuid(ps, 7, repliedTo);
            ps.setBoolean(8, forwarded);
            ps.setString(9, forwardedFrom);
            ps.setTimestamp(10, timestamp(now));
            ps.setTimestamp(11, timestamp(now));
            ps.executeUpdate();
        }
    }

    private static void insertReadMark(Connection conn, String messageId, String userId, Instant now)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_READ)) {
            setUuid(ps, 1, messageId);
            setUuid(ps, 2, userId);
            ps.setTimestamp(3, timestamp(now));
            ps.executeUpdate();
        }
    }

    private static void copyFiles(Connection conn, String fromMessage, String toMessage, Instant now)
            throws SQLException {
        List<FileAttachment> files = files(conn, fromMessage);
        if (files.isEmpty()) return;
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO files (id, message_id, file_name, file_path, file_type, file_size, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            for (FileAttachment f : files) {
                setUuid(ps, 1, UUID.randomUUID().toString());
                setUuid(ps, 2, toMessage);
                ps.setString(3, f.fileName());
                ps.setString(4, f.filePath());
                ps.setString(5, f.fileType());
                if (f.fileSize() == null) {
                    ps.setNull(6, Types.BIGINT);
                } else {
                    ps.setLong(6, f.fileSize());
                }
                ps.setTimestamp(7, timestamp(now));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static String username(Connection conn, String userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_USERNAME)) {
            setUuid(ps, 1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new RealtimeException(ErrorCode.USER_NOT_FOUND, "User not found");
                }
                return rs.getString(1);
            }
        }
    }

    private static Optional<StoredMessage> findMessage(Connection conn, String messageId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_MESSAGE)) {
            setUuid(ps, 1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new StoredMessage(
                        rs.getString("id"),
                        target(rs.getString("dialog_id"), rs.getString("group_id")),
                        rs.getString("sender_id"),
                        rs.getString("sender_username"),
                        rs.getString("content")));
            }
        }
    }

    private static HydratedMessage hydrate(Connection conn, String messageId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_HYDRATED)) {
            setUuid(ps, 1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Message vanished after insert: " + messageId);
                }
                String repliedTo = rs.getString("replied_to_message_id");
                String repliedContent = repliedTo == null ? null : replyPreview(conn, repliedTo, rs.getString("replied_content"));
                return new HydratedMessage(
                        rs.getString("id"),
                        rs.getString("dialog_id"),
                        rs.getString("group_id"),
                        rs.getString("sender_id"),
                        rs.getString("sender_username"),
                        rs.getString("sender_avatar"),
                        rs.getString("content"),
                        iso(rs.getTimestamp("created_at")),
                        rs.getBoolean("is_edited"),
                        rs.getBoolean("is_forwarded"),
                        rs.getString("forwarded_from_username"),
                        repliedTo,
                        rs.getString("replied_sender"),
                        repliedContent,
                        files(conn, messageId),
                        reads(conn, messageId));
            }
        }
    }

    /** First characters of the replied message, or its first file name when it has no text. */
    private static String replyPreview(Connection conn, String repliedTo, String content) throws SQLException {
        if (content != null && !content.isEmpty()) {
            return content.length() > REPLY_PREVIEW_LENGTH
                    ? content.substring(0, REPLY_PREVIEW_LENGTH) + "..."
                    : content;
        }
        List<FileAttachment> files = files(conn, repliedTo);
        return files.isEmpty() ? null : "File: " + files.get(0).fileName();
    }

    private static List<FileAttachment> files(Connection conn, String messageId) throws SQLException {
        List<FileAttachment> files = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_FILES)) {
            setUuid(ps, 1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long size = rs.getLong("file_size");
                    Long fileSize = rs.wasNull() ? null : size;
                    files.add(new FileAttachment(
                            rs.getString("id"),
                            rs.getString("file_name"),
                            rs.getString("file_path"),
                            rs.getString("file_type"),
                            fileSize));
                }
            }
        }
        return files;
    }

    private static List<ReadReceipt> reads(Connection conn, String messageId) throws SQLException {
        List<ReadReceipt> reads = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_READS)) {
            setUuid(ps, 1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    reads.add(new ReadReceipt(rs.getString(1), rs.getString(2), iso(rs.getTimestamp(3))));
                }
            }
        }
        return reads;
    }

    private static ConversationTarget target(String dialogId, String groupId) {
        return dialogId != null ? ConversationTarget.dialog(dialogId) : ConversationTarget.group(groupId);
    }
}

package com.chatrelay.server.support;

import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.EditedMessage;
import com.chatrelay.server.model.HydratedMessage;
import com.chatrelay.server.model.NewMessage;
import com.chatrelay.server.model.ReadReceipt;
import com.chatrelay.server.model.StoredMessage;
import com.chatrelay.server.store.ConversationStore;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存会话仓储，统计写入次数。
 */
public class InMemoryConversationStore implements ConversationStore {

    private final Clock clock;
    private final Map<ConversationTarget, Set<String>> participants = new LinkedHashMap<>();
    private final Map<String, String> usernames = new LinkedHashMap<>();
    private final Map<String, StoredMessage> messages = new LinkedHashMap<>();
    private final Map<String, Set<String>> reads = new LinkedHashMap<>();
    private final Set<String> failingForwardTargets = new LinkedHashSet<>();
    private final AtomicInteger writes = new AtomicInteger();
    private boolean failParticipantLookups;
    private final AtomicInteger participantChecks = new AtomicInteger();

    public InMemoryConversationStore(Clock clock) {
        this.clock = clock;
    }

    public synchronized void registerUser(String userId, String username) {
        usernames.put(userId, username);
    }

    public synchronized void addParticipants(ConversationTarget target, String... userIds) {
        Set<String> set = participants.computeIfAbsent(target, k -> new LinkedHashSet<>());
        for (String id : userIds) set.add(id);
    }

    public synchronized void removeParticipant(ConversationTarget target, String userId) {
        Set<String> set = participants.get(target);
        if (set != null) set.remove(userId);
    }

    public synchronized void failForwardsInto(String targetId) {
        failingForwardTargets.add(targetId);
    }

    /** Makes {@link #findParticipantIds} fail the way a lost connection would. */
    public synchronized void failParticipantLookups(boolean fail) {
        failParticipantLookups = fail;
    }

    /** Seeds a message directly, bypassing the write counter. */
    public synchronized StoredMessage seedMessage(ConversationTarget target, String senderId, String content) {
        String id = UUID.randomUUID().toString();
        StoredMessage message = new StoredMessage(id, target, senderId, usernames.get(senderId), content);
        messages.put(id, message);
        return message;
    }

    @Override
    public synchronized boolean isParticipant(String userId, ConversationTarget target) {
        participantChecks.incrementAndGet();
        return participants.getOrDefault(target, Set.of()).contains(userId);
    }

    @Override
    public synchronized List<String> findParticipantIds(ConversationTarget target) {
        if (failParticipantLookups) {
            throw new StoreException("participant lookup failed", null);
        }
        return new ArrayList<>(participants.getOrDefault(target, Set.of()));
    }

    @Override
    public synchronized boolean messageExistsIn(String messageId, ConversationTarget target) {
        StoredMessage message = messages.get(messageId);
        return message != null && message.target().equals(target);
    }

    @Override
    public synchronized HydratedMessage createMessage(NewMessage message) {
        writes.incrementAndGet();
        String id = UUID.randomUUID().toString();
        StoredMessage stored = new StoredMessage(id, message.target(), message.senderId(),
                usernames.get(message.senderId()), message.content());
        messages.put(id, stored);
        reads.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(message.senderId());
        return hydrate(stored, false, null, message.repliedToMessageId());
    }

    @Override
    public synchronized Optional<StoredMessage> findMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public synchronized EditedMessage updateMessageContent(String messageId, String content) {
        writes.incrementAndGet();
        StoredMessage old = messages.get(messageId);
        StoredMessage updated = new StoredMessage(old.id(), old.target(), old.senderId(), old.senderUsername(), content);
        messages.put(messageId, updated);
        return new EditedMessage(messageId, old.target(), old.senderId(), content, clock.instant().toString());
    }

    @Override
    public synchronized void deleteMessage(String messageId) {
        writes.incrementAndGet();
        messages.remove(messageId);
        reads.remove(messageId);
    }

    @Override
    public synchronized List<String> markRead(String userId, ConversationTarget target, List<String> messageIds) {
        List<String> marked = new ArrayList<>();
        for (String id : messageIds) {
            StoredMessage message = messages.get(id);
            if (message == null || !message.target().equals(target)) continue;
            reads.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(userId);
            marked.add(id);
        }
        writes.incrementAndGet();
        return marked;
    }

    @Override
    public synchronized HydratedMessage forwardMessage(StoredMessage source, ConversationTarget target, String senderId) {
        if (failingForwardTargets.contains(target.id())) {
            throw new StoreException("forward failed", new SQLException("simulated"));
        }
        writes.incrementAndGet();
        String id = UUID.randomUUID().toString();
        StoredMessage copy = new StoredMessage(id, target, senderId, usernames.get(senderId), source.content());
        messages.put(id, copy);
        reads.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(senderId);
        return hydrate(copy, true, source.senderUsername(), null);
    }

    private HydratedMessage hydrate(StoredMessage m, boolean forwarded, String forwardedFrom, String repliedTo) {
        List<ReadReceipt> receipts = new ArrayList<>();
        for (String reader : reads.getOrDefault(m.id(), Set.of())) {
            receipts.add(new ReadReceipt(reader, usernames.get(reader), clock.instant().toString()));
        }
        return new HydratedMessage(m.id(), m.target().dialogId(), m.target().groupId(), m.senderId(),
                m.senderUsername(), null, m.content(), clock.instant().toString(), false, forwarded,
                forwardedFrom, repliedTo, null, null, List.of(), receipts);
    }

    public int writes() {
        return writes.get();
    }

    public int participantChecks() {
        return participantChecks.get();
    }

    public synchronized int messageCount() {
        return messages.size();
    }

    public synchronized List<StoredMessage> messagesIn(ConversationTarget target) {
        List<StoredMessage> result = new ArrayList<>();
        for (StoredMessage m : messages.values()) {
            if (m.target().equals(target)) result.add(m);
        }
        return result;
    }

    public synchronized Set<String> readersOf(String messageId) {
        return Set.copyOf(reads.getOrDefault(messageId, Set.of()));
    }
}

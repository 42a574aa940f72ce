package com.chatrelay.server.ws;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 管理房间与连接 id 的双向映射关系。
 */
@Component
public class RoomRegistry {

    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> memberships = new ConcurrentHashMap<>();

    public void add(String room, String connectionId) {
        rooms.compute(room, (k, members) -> {
            Set<String> set = members != null ? members : ConcurrentHashMap.newKeySet();
            set.add(connectionId);
            return set;
        });
        memberships.compute(connectionId, (k, joined) -> {
            Set<String> set = joined != null ? joined : ConcurrentHashMap.newKeySet();
            set.add(room);
            return set;
        });
    }

    public void remove(String room, String connectionId) {
        rooms.computeIfPresent(room, (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
        memberships.computeIfPresent(connectionId, (k, joined) -> {
            joined.remove(room);
            return joined.isEmpty() ? null : joined;
        });
    }

    /** Drops the connection from every room it joined and returns those rooms. */
    public Set<String> removeAll(String connectionId) {
        Set<String> joined = memberships.remove(connectionId);
        if (joined == null) return Set.of();
        for (String room : joined) {
            rooms.computeIfPresent(room, (k, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
        }
        return Set.copyOf(joined);
    }

    public Set<String> members(String room) {
        Set<String> members = rooms.get(room);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public Set<String> roomsOf(String connectionId) {
        Set<String> joined = memberships.get(connectionId);
        return joined == null ? Set.of() : Set.copyOf(joined);
    }
}

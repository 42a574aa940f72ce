package com.chatrelay.server.session;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps connections to authenticated users and keeps the per-user session count.
 * All reads and writes go through one monitor so a count returned from
 * {@link #register} or {@link #unregister} is exact at the moment of the mutation.
 * Callers must never do store I/O while holding it; nothing here calls out.
 */
@Component
public class SessionRegistry {

    private final Map<String, Session> byConnection = new HashMap<>();
    private final Map<String, Set<String>> connectionsByUser = new HashMap<>();

    public synchronized Registration register(String connectionId, String userId, String username) {
        boolean wasOnline = connectionsByUser.containsKey(userId);
        Session session = new Session(connectionId, userId, username);
        Session previous = byConnection.put(connectionId, session);

        Departure displaced = null;
        if (previous != null && !previous.userId().equals(userId)) {
            displaced = new Departure(previous, detach(previous));
        }

        Set<String> connections = connectionsByUser.computeIfAbsent(userId, k -> new LinkedHashSet<>());
        connections.add(connectionId);
        return new Registration(session, connections.size(), !wasOnline, displaced);
    }

    public synchronized Optional<Departure> unregister(String connectionId) {
        Session removed = byConnection.remove(connectionId);
        if (removed == null) return Optional.empty();
        return Optional.of(new Departure(removed, detach(removed)));
    }

    /** Removes every session of a user in one step; the last departure reports zero remaining. */
    public synchronized List<Departure> unregisterAll(String userId) {
        Set<String> connections = connectionsByUser.remove(userId);
        if (connections == null) return List.of();
        List<Departure> departures = new ArrayList<>();
        int remaining = connections.size();
        for (String connectionId : connections) {
            Session removed = byConnection.remove(connectionId);
            remaining--;
            if (removed != null) departures.add(new Departure(removed, remaining));
        }
        return departures;
    }

    public synchronized Optional<Session> lookup(String connectionId) {
        return Optional.ofNullable(byConnection.get(connectionId));
    }

    public synchronized int countSessionsFor(String userId) {
        Set<String> connections = connectionsByUser.get(userId);
        return connections == null ? 0 : connections.size();
    }

    public synchronized Set<String> connectionsOf(String userId) {
        Set<String> connections = connectionsByUser.get(userId);
        return connections == null ? Set.of() : Set.copyOf(connections);
    }

    private int detach(Session session) {
        Set<String> connections = connectionsByUser.get(session.userId());
        if (connections == null) return 0;
        connections.remove(session.connectionId());
        if (connections.isEmpty()) {
            connectionsByUser.remove(session.userId());
            return 0;
        }
        return connections.size();
    }
}

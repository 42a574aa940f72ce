package com.chatrelay.server.room;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.Identifiers;

/**
 * A room name built from a kind and an entity id. Prefixes are distinct and ids are
 * validated UUIDs, so names of different kinds can never collide.
 */
public final class RoomName {

    private static final RoomName GENERAL_TASKS = new RoomName(RoomKind.GENERAL_TASKS, null);

    private final RoomKind kind;
    private final String entityId;

    private RoomName(RoomKind kind, String entityId) {
        this.kind = kind;
        this.entityId = entityId;
    }

    public static RoomName of(RoomKind kind, String entityId) {
        if (kind == RoomKind.GENERAL_TASKS) return GENERAL_TASKS;
        if (!Identifiers.isUuid(entityId)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid " + kind.label() + " ID format");
        }
        return new RoomName(kind, Identifiers.normalize(entityId));
    }

    public static RoomName generalTasks() {
        return GENERAL_TASKS;
    }

    public RoomKind kind() {
        return kind;
    }

    public String entityId() {
        return entityId;
    }

    public String value() {
        return entityId == null ? kind.prefix() : kind.prefix() + entityId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomName other)) return false;
        return value().equals(other.value());
    }

    @Override
    public int hashCode() {
        return value().hashCode();
    }

    @Override
    public String toString() {
        return value();
    }
}

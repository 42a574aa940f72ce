package com.chatrelay.server.ws;

/**
 * Connection-level delivery. Every emit is fire-and-forget: a failed or closed
 * recipient is logged and skipped, never reported back to the caller.
 */
public interface RealtimeTransport {

    void join(String connectionId, String room);

    void leave(String connectionId, String room);

    void leaveAll(String connectionId);

    /**
     * @param excludedConnectionId connection to skip, or {@code null} to reach every member
     */
    void emitToRoom(String room, String event, Object payload, String excludedConnectionId);

    void emitToConnection(String connectionId, String event, Object payload);

    void emitToAll(String event, Object payload);

    /** Closes the connection from the server side. */
    void disconnect(String connectionId);
}

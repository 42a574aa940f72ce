package com.chatrelay.server.ws;

/** Names of the events the server emits. */
public final class EventNames {

    public static final String AUTHENTICATED = "authenticated";
    public static final String USER_STATUS_CHANGED = "userStatusChanged";
    public static final String NEW_MESSAGE = "newMessage";
    public static final String MESSAGE_EDITED = "messageEdited";
    public static final String MESSAGE_DELETED = "messageDeleted";
    public static final String MESSAGES_READ = "messagesRead";
    public static final String MESSAGE_READ_UPDATE = "messageReadUpdate";
    public static final String MESSAGES_FORWARDED = "messagesForwarded";
    public static final String NOTIFICATION = "notification";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOPPED_TYPING = "user_stopped_typing";
    public static final String USER_JOINED_DIALOG = "userJoinedDialog";
    public static final String USER_JOINED_GROUP = "userJoinedGroup";
    public static final String TASK_STATUS = "taskStatus";
    public static final String JOIN_EVENT_ROOM_SUCCESS = "joinEventRoom_success";
    public static final String LEAVE_EVENT_ROOM_SUCCESS = "leaveEventRoom_success";
    public static final String EVENT_PARTICIPANT_STATUS_UPDATED = "eventParticipantStatusUpdated";
    public static final String UPDATE_MY_EVENT_STATUS_SUCCESS = "updateMyEventStatus_success";
    public static final String CONTACT_ADDED = "contactAdded";
    public static final String CONTACT_REMOVED = "contactRemoved";

    private EventNames() {
    }

    /** Failure event for an inbound operation; authenticate has its own name. */
    public static String failed(String inboundEvent) {
        if ("authenticate".equals(inboundEvent)) return "authentication_failed";
        return inboundEvent + "_failed";
    }
}

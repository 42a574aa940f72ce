package com.chatrelay.server.room;

public enum RoomKind {
    USER("user:", "user"),
    DIALOG("dialog:", "dialog"),
    GROUP("group:", "group"),
    TASK("task:", "task"),
    EVENT("event:", "event"),
    GENERAL_TASKS("general_tasks", "general tasks");

    private final String prefix;
    private final String label;

    RoomKind(String prefix, String label) {
        this.prefix = prefix;
        this.label = label;
    }

    public String prefix() {
        return prefix;
    }

    public String label() {
        return label;
    }
}

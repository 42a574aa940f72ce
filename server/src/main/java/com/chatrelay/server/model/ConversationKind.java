package com.chatrelay.server.model;

public enum ConversationKind {
    DIALOG("dialog_id", "dialog_participants"),
    GROUP("group_id", "group_participants");

    private final String idColumn;
    private final String participantTable;

    ConversationKind(String idColumn, String participantTable) {
        this.idColumn = idColumn;
        this.participantTable = participantTable;
    }

    /** Wire field and column name of the conversation id. */
    public String idColumn() {
        return idColumn;
    }

    public String participantTable() {
        return participantTable;
    }

    public String label() {
        return this == DIALOG ? "dialog" : "group";
    }
}

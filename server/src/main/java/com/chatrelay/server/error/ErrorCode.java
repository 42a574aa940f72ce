package com.chatrelay.server.error;

/**
 * Wire-level error codes carried by {@code <event>_failed} frames.
 */
public enum ErrorCode {
    AUTH_FAILED(Category.AUTH),
    AUTH_MISMATCH(Category.AUTH),
    UNAUTHENTICATED(Category.AUTH),

    MISSING_ID(Category.VALIDATION),
    INVALID_INPUT(Category.VALIDATION),
    EMPTY_MESSAGE(Category.VALIDATION),
    INVALID_ID(Category.VALIDATION),
    INVALID_EVENT_ID(Category.VALIDATION),
    CONTENT_TOO_LONG(Category.VALIDATION),
    INVALID_CONTENT(Category.VALIDATION),
    INVALID_MESSAGE_IDS(Category.VALIDATION),
    INVALID_STATUS(Category.VALIDATION),

    NOT_PARTICIPANT(Category.AUTHORIZATION),
    ACCESS_DENIED(Category.AUTHORIZATION),
    PERMISSION_DENIED(Category.AUTHORIZATION),
    CREATOR_STATUS_LOCKED(Category.AUTHORIZATION),

    RATE_LIMIT_EXCEEDED(Category.RATE_LIMIT),

    USER_NOT_FOUND(Category.NOT_FOUND),
    MESSAGE_NOT_FOUND(Category.NOT_FOUND),
    EVENT_NOT_FOUND(Category.NOT_FOUND),
    FILE_NOT_FOUND(Category.NOT_FOUND),
    INVALID_REPLY_ID(Category.NOT_FOUND),

    DB_ERROR(Category.STORE),
    SERVER_ERROR(Category.INTERNAL);

    public enum Category {
        AUTH, VALIDATION, AUTHORIZATION, RATE_LIMIT, NOT_FOUND, STORE, INTERNAL
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}

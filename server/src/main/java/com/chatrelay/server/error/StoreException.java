package com.chatrelay.server.error;

/**
 * Failure talking to the relational store. Reported to clients as {@code DB_ERROR}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

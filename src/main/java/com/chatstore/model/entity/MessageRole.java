package com.chatstore.model.entity;

import java.util.Locale;

/**
 * Author of a chat message. Stored lower-case in chat_messages.role.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

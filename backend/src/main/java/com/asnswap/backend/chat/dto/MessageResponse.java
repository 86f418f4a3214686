package com.asnswap.backend.chat.dto;

import java.time.LocalDateTime;

import com.asnswap.backend.chat.domain.ChatMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

public record MessageResponse(
        @JsonProperty("from_email") String fromEmail,
        @JsonProperty("to_email") String toEmail,
        String content,
        boolean read,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
    public static MessageResponse from(ChatMessage m) {
        return new MessageResponse(m.getFromEmail(), m.getToEmail(), m.getContent(), m.isRead(), m.getCreatedAt());
    }
}

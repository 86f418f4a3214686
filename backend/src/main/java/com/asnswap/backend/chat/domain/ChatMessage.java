package com.asnswap.backend.chat.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "chat_message",
       indexes = {
               @Index(name = "idx_chat_message_from_to", columnList = "from_email, to_email, created_at"),
               @Index(name = "idx_chat_message_to", columnList = "to_email")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_email", nullable = false, length = 255)
    private String fromEmail; // 항상 인증된 발신자

    @Column(name = "to_email", nullable = false, length = 255)
    private String toEmail;

    @Column(nullable = false, length = 2000)
    private String content;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static ChatMessage create(String fromEmail, String toEmail, String content, LocalDateTime now) {
        ChatMessage m = new ChatMessage();
        m.fromEmail = fromEmail;
        m.toEmail = toEmail;
        m.content = content;
        m.read = false;
        m.createdAt = now;
        return m;
    }
}

package com.asnswap.backend.chat.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.asnswap.backend.auth.identity.otp.support.EmailNormalizer;
import com.asnswap.backend.chat.domain.ChatMessage;
import com.asnswap.backend.chat.dto.MessageResponse;
import com.asnswap.backend.chat.repo.ChatMessageRepository;

import lombok.RequiredArgsConstructor;

/**
 * 1:1 채팅
 * - send: 발신자는 호출 측이 넘긴 인증 email (요청 바디 값 아님)
 * - history: 본인과 상대 사이의 메시지만 조회 가능 (제3자 대화 조회 불가)
 */
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ChatMessageRepository messageRepository;
    private final Clock clock;

    @Transactional
    public void send(String actorEmail, String rawToEmail, String content) {
        String toEmail = EmailNormalizer.normalize(rawToEmail);
        messageRepository.save(ChatMessage.create(actorEmail, toEmail, content, LocalDateTime.now(clock)));
    }

    @Transactional(readOnly = true)
    public List<MessageResponse> history(String actorEmail, String rawWithEmail) {
        String with = EmailNormalizer.normalize(rawWithEmail);
        return messageRepository.findConversation(actorEmail, with).stream()
                .map(MessageResponse::from)
                .toList();
    }
}

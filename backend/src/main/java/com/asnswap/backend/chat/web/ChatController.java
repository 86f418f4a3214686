package com.asnswap.backend.chat.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.chat.dto.ChatHistoryResponse;
import com.asnswap.backend.chat.dto.SendMessageRequest;
import com.asnswap.backend.chat.dto.SendStatusResponse;
import com.asnswap.backend.chat.service.ChatService;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    @PostMapping("/send")
    public SendStatusResponse send(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody SendMessageRequest req) {
        chatService.send(requireActor(principal), req.toEmail(), req.content());
        return SendStatusResponse.sent();
    }

    @GetMapping("/history")
    public ChatHistoryResponse history(
            @AuthenticationPrincipal AuthPrincipal principal,
            @RequestParam("with") @NotBlank @Email String with) {
        return new ChatHistoryResponse(chatService.history(requireActor(principal), with));
    }

    private static String requireActor(AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.UNAUTHENTICATED);
        }
        return principal.email();
    }
}

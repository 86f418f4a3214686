package com.asnswap.backend.chat.dto;

import java.util.List;

public record ChatHistoryResponse(List<MessageResponse> messages) {}

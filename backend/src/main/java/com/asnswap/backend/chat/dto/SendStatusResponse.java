package com.asnswap.backend.chat.dto;

public record SendStatusResponse(String status) {

    public static SendStatusResponse sent() {
        return new SendStatusResponse("sent");
    }
}

package com.asnswap.backend.auth.identity.me.dto;

public record MeResponse(String email) {}

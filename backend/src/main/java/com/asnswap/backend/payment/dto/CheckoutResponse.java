package com.asnswap.backend.payment.dto;

public record CheckoutResponse(String id, String url) {}

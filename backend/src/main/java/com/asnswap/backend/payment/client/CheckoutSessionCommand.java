package com.asnswap.backend.payment.client;

/**
 * 체크아웃 세션 생성 입력
 * - successUrl은 Stripe 템플릿 변수 {CHECKOUT_SESSION_ID}를 그대로 포함한다.
 */
public record CheckoutSessionCommand(
        String customerEmail,
        String successUrl,
        String cancelUrl
) {}

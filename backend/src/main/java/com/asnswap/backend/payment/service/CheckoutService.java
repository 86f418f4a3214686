package com.asnswap.backend.payment.service;

import org.springframework.stereotype.Service;

import com.asnswap.backend.auth.identity.otp.support.EmailNormalizer;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.payment.client.CheckoutSession;
import com.asnswap.backend.payment.client.CheckoutSessionCommand;
import com.asnswap.backend.payment.client.PaymentProviderException;
import com.asnswap.backend.payment.client.StripeCheckoutClient;
import com.asnswap.backend.payment.config.PaymentProperties;
import com.asnswap.backend.payment.dto.CheckoutResponse;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 구독 결제 세션 생성
 * - 키 미설정: 500 PAYMENT_NOT_CONFIGURED (운영 설정 문제)
 * - 제공자 거절/전송 실패: 400 PAYMENT_REQUEST_FAILED
 * 결제 완료 처리(webhook)는 이 서비스 범위 밖이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private static final String SUCCESS_PATH = "/success?session_id={CHECKOUT_SESSION_ID}";

    private final StripeCheckoutClient stripeClient;
    private final PaymentProperties props;

    public CheckoutResponse createSession(String rawEmail) {
        if (!props.stripe().configured()) {
            log.error("결제 세션 요청 거부: app.payment.stripe.secret-key 미설정");
            throw new ApiException(ErrorCode.PAYMENT_NOT_CONFIGURED);
        }

        String frontend = stripTrailingSlash(props.frontendUrl());
        CheckoutSessionCommand cmd = new CheckoutSessionCommand(
                EmailNormalizer.normalize(rawEmail),
                frontend + SUCCESS_PATH,
                frontend + "/");

        try {
            CheckoutSession session = stripeClient.createSubscriptionSession(cmd);
            log.info("결제 세션 생성. email={}, sessionId={}", cmd.customerEmail(), session.id());
            return new CheckoutResponse(session.id(), session.url());
        } catch (PaymentProviderException e) {
            log.warn("결제 세션 생성 실패. status={}, message={}, body={}", e.getStatus(), e.getMessage(), e.getBodySnippet());
            throw new ApiException(ErrorCode.PAYMENT_REQUEST_FAILED, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package com.asnswap.backend.payment.client;

import lombok.Getter;

/**
 * 결제 제공자 호출 실패 (4xx/5xx 응답, 빈 응답, 전송 실패)
 * - status: 제공자 HTTP 상태, 전송 실패면 0
 */
@Getter
public class PaymentProviderException extends RuntimeException {

    private final int status;
    private final String bodySnippet;

    public PaymentProviderException(int status, String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }
}

package com.asnswap.backend.payment.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/*
  app:
    payment:
      frontend-url: ${FRONTEND_URL:http://localhost:3000}
      stripe:
        secret-key: ${STRIPE_SECRET_KEY:}     # 비어 있으면 결제 API는 500 PAYMENT_NOT_CONFIGURED
        base-url: https://api.stripe.com
        currency: idr
        unit-amount: 5000000                # 통화 최소 단위
        product-name: Langganan ASN Swap
        product-description: Akses fitur pencarian, match, dan chat
        connect-timeout: PT3S
        read-timeout: PT10S

  secret-key는 기동 시 필수가 아니다. 결제 없이도 나머지 기능은 떠야 한다.
 */
@Validated
@ConfigurationProperties(prefix = "app.payment")
public record PaymentProperties(
        @NotBlank String frontendUrl,
        @Valid @NotNull Stripe stripe
) {

    public record Stripe(
            String secretKey,
            @NotBlank String baseUrl,
            @NotBlank String currency,
            @Min(1) long unitAmount,
            @NotBlank String productName,
            String productDescription,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout
    ) {
        public boolean configured() {
            return secretKey != null && !secretKey.isBlank();
        }
    }
}

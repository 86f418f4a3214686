package com.asnswap.backend.payment.client;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.asnswap.backend.payment.config.PaymentProperties;

/**
 * Stripe Checkout Session 생성 어댑터
 * - POST /v1/checkout/sessions (application/x-www-form-urlencoded)
 * - 월 구독 1개 품목(price_data 인라인)
 *
 * HTTP 에러(4xx/5xx)는 JSON 파싱 실패와 섞이지 않게 onStatus에서 먼저 PaymentProviderException으로 바꾼다.
 */
@Component
public class StripeCheckoutClient {

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;
    private static final String ITEM = "line_items[0]";

    private final RestClient http;
    private final PaymentProperties.Stripe stripe;

    public StripeCheckoutClient(
            @Qualifier("stripeRestClient") RestClient http,
            PaymentProperties props
    ) {
        this.http = http;
        this.stripe = props.stripe();
    }

    public CheckoutSession createSubscriptionSession(CheckoutSessionCommand cmd) {
        CheckoutSession session;
        try {
            session = http.post()
                    .uri("/v1/checkout/sessions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + stripe.secretKey())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(buildForm(cmd))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        throw new PaymentProviderException(
                                status,
                                "Stripe responded " + status,
                                readBodySnippet(res.getBody()),
                                null);
                    })
                    .body(CheckoutSession.class);
        } catch (PaymentProviderException e) {
            throw e;
        } catch (RestClientException e) {
            throw new PaymentProviderException(0, "Stripe request failed: " + e.getMessage(), null, e);
        }

        if (session == null || session.id() == null || session.url() == null) {
            throw new PaymentProviderException(200, "Stripe returned an empty session", null, null);
        }
        return session;
    }

    MultiValueMap<String, String> buildForm(CheckoutSessionCommand cmd) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "subscription");
        form.add("payment_method_types[0]", "card");
        if (cmd.customerEmail() != null) {
            form.add("customer_email", cmd.customerEmail());
        }
        form.add(ITEM + "[quantity]", "1");
        form.add(ITEM + "[price_data][currency]", stripe.currency());
        form.add(ITEM + "[price_data][unit_amount]", String.valueOf(stripe.unitAmount()));
        form.add(ITEM + "[price_data][recurring][interval]", "month");
        form.add(ITEM + "[price_data][product_data][name]", stripe.productName());
        if (stripe.productDescription() != null && !stripe.productDescription().isBlank()) {
            form.add(ITEM + "[price_data][product_data][description]", stripe.productDescription());
        }
        form.add("success_url", cmd.successUrl());
        form.add("cancel_url", cmd.cancelUrl());
        return form;
    }

    private static String readBodySnippet(InputStream in) throws IOException {
        if (in == null) return null;
        try (in) {
            byte[] bytes = in.readNBytes(MAX_ERROR_SNIPPET_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}

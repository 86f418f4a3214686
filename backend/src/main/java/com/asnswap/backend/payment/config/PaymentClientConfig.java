package com.asnswap.backend.payment.config;

import java.net.http.HttpClient;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 결제 제공자(Stripe) 호출용 RestClient
 * - 연결/응답 타임아웃을 걸어서 제공자 장애가 요청 스레드를 붙잡지 않게 한다.
 * - 인증 헤더는 호출 시점에 붙인다. (키 미설정 상태로도 기동 가능해야 함)
 */
@Configuration
@EnableConfigurationProperties(PaymentProperties.class)
public class PaymentClientConfig {

    @Bean("stripeRestClient")
    public RestClient stripeRestClient(PaymentProperties props) {
        PaymentProperties.Stripe stripe = props.stripe();

        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(stripe.connectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(stripe.readTimeout());

        return RestClient.builder()
                .baseUrl(stripe.baseUrl())
                .requestFactory(rf)
                .build();
    }
}

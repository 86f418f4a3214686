package com.asnswap.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 인증 모듈 공통 Bean + 설정 바인딩
 *
 * @EnableConfigurationProperties
 *  - 여기서 등록한 properties record들은 기동 시 한 번만 바인딩 + 검증되고,
 *    이후에는 불변 객체로 각 컴포넌트에 생성자 주입된다. (요청 처리 중 환경변수 직접 조회 금지)
 */
@Configuration
@EnableConfigurationProperties({
        OtpProperties.class,
        AuthProperties.class,
        AppMailProperties.class,
        AdminProperties.class
})
public class AuthModuleConfig {

    private static final ZoneId WIB = ZoneId.of("Asia/Jakarta");

    /**
     * 서버 표준 타임존을 WIB로 고정한다.
     * - 테스트에서는 고정/이동 가능한 Clock을 따로 주입하므로 이 @Bean은 만들어지지 않는다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(WIB);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}

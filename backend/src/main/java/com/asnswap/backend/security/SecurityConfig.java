package com.asnswap.backend.security;

import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import com.asnswap.backend.auth.config.AdminProperties;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - Bearer 세션 토큰 인증: JwtAuthenticationFilter
 * - 인증 없음: RestAuthEntryPoint (401 UNAUTHENTICATED)
 * - 권한 부족: RestAccessDeniedHandler (403 ACCESS_DENIED)
 *
 * - CORS: 프론트엔드 origin만 허용 (CorsProperties). preflight는 인증 없이 통과
 *
 * 세션/쿠키 인증을 쓰지 않으므로 CSRF, HTTP Basic, formLogin은 끈다.
 */
@Configuration
@EnableConfigurationProperties(CorsProperties.class)
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final AdminProperties adminProperties;
    private final SecurityErrorWriter securityErrorWriter;
    private final CorsProperties corsProperties;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    RestAccessDeniedHandler restAccessDeniedHandler() {
        return new RestAccessDeniedHandler(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(jwtService, adminProperties, securityErrorWriter);
    }

    @Bean
    CorsConfigurationSource corsConfigurationSource() {
        return corsConfigurationSource(corsProperties);
    }

    static CorsConfigurationSource corsConfigurationSource(CorsProperties props) {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(props.allowedOrigins());
        config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("Authorization", "Content-Type"));
        config.setAllowCredentials(false);
        config.setMaxAge(props.maxAge());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(restAuthEntryPoint())
                        .accessDeniedHandler(restAccessDeniedHandler()))
                .addFilterBefore(jwtAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class)
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.GET, "/").permitAll()
                        .requestMatchers("/actuator/health/**").permitAll()

                        // OTP 요청/검증
                        .requestMatchers("/api/auth/**").permitAll()

                        // 공개 조회
                        .requestMatchers(HttpMethod.GET, "/api/profile/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/search").permitAll()

                        // 결제 세션 생성 (이메일은 바디로 받는다)
                        .requestMatchers(HttpMethod.POST, "/api/checkout/session").permitAll()

                        .requestMatchers("/api/admin/**").hasRole("ADMIN")

                        // 그 외는 인증 필요 (/api/me, POST /api/profile, /api/chat/** 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}

package com.asnswap.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.asnswap.backend.auth.config.AuthProperties;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * 세션 토큰(JWT) 발급/검증 서비스
 *
 * - HTTP(상태코드/응답)는 모른다. "유효/무효"만 판단한다.
 * - 서버에 토큰 상태를 저장하지 않는다. 서명 + exp 만으로 판정 (Stateless)
 * - 검증 실패 사유(형식/서명/issuer/만료/스킴)는 전부 InvalidJwtException 하나로 뭉갠다.
 *   어느 단계에서 떨어졌는지 클라이언트에게 알려줄 이유가 없다.
 *
 * 클레임: iss / sub(email) / iat / exp(= iat + ttl)
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;
        this.key = buildHmacKey(jwtProps.secret());
        this.parser = buildParser(jwtProps.issuer(), this.key, this.clock);
    }

    /** 검증된 email 기준 세션 토큰 발급 */
    public String issueSessionToken(String email) {
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email must not be blank");

        Instant now = nowSeconds(clock);
        Instant exp = now.plusSeconds(jwtProps.ttlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())    // iss
                .setSubject(email)               // sub
                .setIssuedAt(Date.from(now))     // iat
                .setExpiration(Date.from(exp))   // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 토큰 문자열 검증 후 subject(email) 반환
     * - 실패 시 InvalidJwtException
     */
    public String verifySessionToken(String token) {
        try {
            if (token == null || token.isBlank()) {
                throw new JwtException("token is null or blank");
            }

            Claims claims = parser.parseClaimsJws(token).getBody();

            String sub = claims.getSubject();
            if (sub == null || sub.isBlank()) {
                throw new JwtException("subject is missing");
            }
            return sub;
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }

    /**
     * Authorization 헤더 값 전체("Bearer <token>")를 받아 email 반환
     * - 헤더 없음 / Bearer 아님 / 토큰 공백도 같은 InvalidJwtException
     */
    public String authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new InvalidJwtException("Missing bearer credentials", null);
        }
        return verifySessionToken(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }

    public long ttlSeconds() {
        return jwtProps.ttlSeconds();
    }

    // iat/exp 클레임은 초 단위. 발급/검증 모두 같은 해상도로 자른다.
    private static Instant nowSeconds(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                // exp가 초 단위로 직렬화되므로 비교하는 now도 초 단위로 맞춘다.
                .setClock(() -> Date.from(nowSeconds(clock)))
                .build();
    }

    /**
     * HTTP 레벨과 분리된 "세션 토큰 검증 실패" 예외
     * - Filter에서 잡아서 401 UNAUTHENTICATED로 변환한다.
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package com.asnswap.backend.security;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.asnswap.backend.auth.config.AdminProperties;
import com.asnswap.backend.auth.domain.UserRole;
import com.asnswap.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Bearer 세션 토큰 인증 필터
 *
 * 정책:
 * - Bearer 토큰이 "없으면" 통과한다. (보호 자원이면 EntryPoint가 401 UNAUTHENTICATED)
 * - Bearer 토큰이 "있는데 유효하지 않으면" 여기서 401 UNAUTHENTICATED로 끝낸다.
 * 두 경로 모두 같은 에러 코드라서 클라이언트 입장에서는 구분되지 않는다.
 */
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final AdminProperties adminProperties;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String email;
        try {
            email = jwtService.authenticate(authHeader);
        } catch (JwtService.InvalidJwtException ex) {
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.UNAUTHENTICATED);
            return;
        }

        UserRole role = adminProperties.isAdmin(email) ? UserRole.ADMIN : UserRole.USER;
        AuthPrincipal principal = new AuthPrincipal(email, role);

        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(principal.authority()))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }
}

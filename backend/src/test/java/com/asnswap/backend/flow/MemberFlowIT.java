package com.asnswap.backend.flow;

import static com.asnswap.backend.auth.support.AuthHttpSupport.bearer;
import static com.asnswap.backend.auth.support.AuthHttpSupport.expectErrorWithCode;
import static com.asnswap.backend.auth.support.AuthFixtures.ADMIN_EMAIL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import com.asnswap.backend.auth.domain.LoginOtp;
import com.asnswap.backend.auth.repo.LoginOtpRepository;
import com.asnswap.backend.chat.repo.ChatMessageRepository;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.infra.AbstractIntegrationTest;
import com.asnswap.backend.infra.TestClockConfig;
import com.asnswap.backend.profile.repo.UserProfileRepository;
import com.asnswap.backend.security.JwtService;

/**
 * 로그인 이후 기능 흐름 (프로필 / 검색 / 채팅 / 관리자 / 결제)
 * - 토큰은 JwtService로 직접 발급 (OTP 흐름은 LoginFlowIT 담당)
 * - 실제 SecurityFilterChain + MySQL 기준으로 인가 규칙과 쿼리를 확인한다.
 */
@DisplayName("[Flow] 프로필/채팅/관리자 통합 흐름")
class MemberFlowIT extends AbstractIntegrationTest {

    private static final String BUDI = "budi@asnswap.id";
    private static final String SITI = "siti@asnswap.id";

    @Autowired MockMvc mvc;
    @Autowired JwtService jwtService;
    @Autowired UserProfileRepository profileRepository;
    @Autowired ChatMessageRepository messageRepository;
    @Autowired LoginOtpRepository otpRepository;

    @BeforeEach
    void clean() {
        messageRepository.deleteAll();
        profileRepository.deleteAll();
        otpRepository.deleteAll();
    }

    @Test
    @DisplayName("프로필 등록 -> 공개 조회 -> 수정 시 created_at 유지 + 검색(대소문자 무시, 와일드카드 문자는 리터럴)")
    void profile_upsert_get_search() throws Exception {
        upsertProfile(BUDI, "Budi", "Kementerian Keuangan", "Jakarta", "Bandung")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("created"));

        mvc.perform(get("/api/profile/" + BUDI))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(BUDI))
                .andExpect(jsonPath("$.desired_region").value("Bandung"))
                .andExpect(jsonPath("$.is_verified").value(false));

        LocalDateTime createdAt = profileRepository.findByEmail(BUDI).orElseThrow().getCreatedAt();
        TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(5));

        upsertProfile(BUDI, "Budi S.", "Kementerian Keuangan", "Jakarta", "Surabaya")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("updated"));

        assertThat(profileRepository.findByEmail(BUDI)).hasValueSatisfying(p -> {
            assertThat(p.getName()).isEqualTo("Budi S.");
            assertThat(p.getDesiredRegion()).isEqualTo("Surabaya");
            assertThat(p.getCreatedAt()).isEqualTo(createdAt);
            assertThat(p.getUpdatedAt()).isAfter(createdAt);
        });

        upsertProfile(SITI, "Siti", "Kementerian 100%", "Medan", "surabaya timur")
                .andExpect(status().isOk());

        mvc.perform(get("/api/search").param("desired_region", "SURABAYA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(2));

        mvc.perform(get("/api/search").param("desired_region", "surabaya").param("current_region", "medan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(1))
                .andExpect(jsonPath("$.results[0].email").value(SITI));

        // '%'는 와일드카드가 아니라 글자 그대로
        mvc.perform(get("/api/search").param("agency", "100%"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(1));
        mvc.perform(get("/api/search").param("agency", "%"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(1));
    }

    @Test
    @DisplayName("프로필 등록은 토큰 필수, 없는 프로필 조회는 404")
    void profile_requires_token_and_missing_is_404() throws Exception {
        expectErrorWithCode(mvc.perform(post("/api/profile")
                .contentType(MediaType.APPLICATION_JSON)
                .content(profileJson("Budi", "Kemenkeu", "Jakarta", "Bandung"))), ErrorCode.UNAUTHENTICATED);

        expectErrorWithCode(mvc.perform(get("/api/profile/nobody@asnswap.id")), ErrorCode.PROFILE_NOT_FOUND);
    }

    @Test
    @DisplayName("채팅: 보낸 메시지는 양쪽 history에 시간순으로, 제3자 대화는 섞이지 않음")
    void chat_send_and_history() throws Exception {
        sendMessage(BUDI, SITI, "Halo Siti").andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("sent"));
        sendMessage(SITI, BUDI, "Halo juga").andExpect(status().isOk());
        sendMessage(BUDI, "andi@asnswap.id", "Bukan untuk Siti").andExpect(status().isOk());

        mvc.perform(get("/api/chat/history").param("with", SITI)
                        .header(HttpHeaders.AUTHORIZATION, bearer(jwtService.issueSessionToken(BUDI))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.messages[0].content").value("Halo Siti"))
                .andExpect(jsonPath("$.messages[1].from_email").value(SITI));

        expectErrorWithCode(mvc.perform(get("/api/chat/history").param("with", SITI)), ErrorCode.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("관리자: 일반 사용자는 403, 관리자는 목록/인증/삭제 가능 + 삭제 시 메시지/OTP까지 정리")
    void admin_operations() throws Exception {
        upsertProfile(BUDI, "Budi", "Kemenkeu", "Jakarta", "Bandung").andExpect(status().isOk());
        sendMessage(BUDI, SITI, "Halo").andExpect(status().isOk());
        otpRepository.save(LoginOtp.create(BUDI, "123456", LocalDateTime.now().plusMinutes(10)));

        String userToken = jwtService.issueSessionToken(BUDI);
        String adminToken = jwtService.issueSessionToken(ADMIN_EMAIL);

        expectErrorWithCode(mvc.perform(get("/api/admin/users")
                .header(HttpHeaders.AUTHORIZATION, bearer(userToken))), ErrorCode.ACCESS_DENIED);
        expectErrorWithCode(mvc.perform(get("/api/admin/users")), ErrorCode.UNAUTHENTICATED);

        mvc.perform(get("/api/admin/users").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users.length()").value(1))
                .andExpect(jsonPath("$.users[0].email").value(BUDI));

        mvc.perform(post("/api/admin/verify")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","verified":true}
                                """.formatted(BUDI)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        mvc.perform(get("/api/profile/" + BUDI))
                .andExpect(jsonPath("$.is_verified").value(true));

        mvc.perform(delete("/api/admin/users/" + BUDI)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));

        assertThat(profileRepository.findByEmail(BUDI)).isEmpty();
        assertThat(messageRepository.count()).isZero();
        assertThat(otpRepository.count()).isZero();
    }

    @Test
    @DisplayName("결제: 익명 호출 가능, 키 미설정이면 PAYMENT_NOT_CONFIGURED")
    void checkout_without_stripe_key() throws Exception {
        expectErrorWithCode(mvc.perform(post("/api/checkout/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email":"%s"}
                        """.formatted(BUDI))), ErrorCode.PAYMENT_NOT_CONFIGURED);
    }

    @Test
    @DisplayName("CORS: 프론트엔드 origin의 preflight는 토큰 없이 통과, 다른 origin은 403")
    void cors_preflight_through_security_chain() throws Exception {
        mvc.perform(options("/api/chat/send")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Authorization, Content-Type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"));

        mvc.perform(options("/api/chat/send")
                        .header(HttpHeaders.ORIGIN, "https://evil.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isForbidden());
    }

    private ResultActions upsertProfile(String email, String name, String agency,
                                        String currentRegion, String desiredRegion) throws Exception {
        return mvc.perform(post("/api/profile")
                .header(HttpHeaders.AUTHORIZATION, bearer(jwtService.issueSessionToken(email)))
                .contentType(MediaType.APPLICATION_JSON)
                .content(profileJson(name, agency, currentRegion, desiredRegion)));
    }

    private ResultActions sendMessage(String from, String to, String content) throws Exception {
        return mvc.perform(post("/api/chat/send")
                .header(HttpHeaders.AUTHORIZATION, bearer(jwtService.issueSessionToken(from)))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"to_email":"%s","content":"%s"}
                        """.formatted(to, content)));
    }

    private static String profileJson(String name, String agency, String currentRegion, String desiredRegion) {
        return """
                {"name":"%s","nip":"198001012005011001","agency":"%s","position":"Analis",
                 "grade":"III/a","current_region":"%s","desired_region":"%s"}
                """.formatted(name, agency, currentRegion, desiredRegion);
    }
}

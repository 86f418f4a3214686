package com.asnswap.backend.health;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.asnswap.backend.infra.AbstractIntegrationTest;

/**
 * Actuator Health
 * - health / liveness / readiness 는 익명 허용
 * - 그 외 actuator 엔드포인트는 노출하지 않는다.
 *
 * Actuator는 application/vnd.spring-boot.actuator.v3+json 같은 vendor media type을 줄 수 있어서
 * "+json suffix"까지 허용하는 media type으로 비교한다.
 */
@DisplayName("[Actuator] health 체크")
class ActuatorHealthIT extends AbstractIntegrationTest {

    @Autowired MockMvc mvc;

    private static final MediaType ANY_JSON_PLUS = MediaType.parseMediaType("application/*+json");

    @Test
    @DisplayName("GET /actuator/health -> 200 + UP")
    void health_up() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(ANY_JSON_PLUS))
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /actuator/health/liveness, readiness -> 200 + UP")
    void liveness_and_readiness_up() throws Exception {
        mvc.perform(get("/actuator/health/liveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        mvc.perform(get("/actuator/health/readiness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET / -> 200 안내 메시지")
    void root_message() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("ASN Location Swap API running"));
    }

    @Test
    @DisplayName("GET /actuator/env -> 노출 안 됨 (익명 401)")
    void other_actuator_endpoints_hidden() throws Exception {
        mvc.perform(get("/actuator/env"))
                .andExpect(status().isUnauthorized());
    }
}

package com.asnswap.backend.global.web;

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

// 프론트/로드밸런서가 찌르는 단순 생존 확인용. 인프라 헬스 체크는 /actuator/health 사용.
@RestController
public class RootController {

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "ASN Location Swap API running");
    }
}

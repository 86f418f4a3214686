package com.asnswap.backend.profile.domain;

// 사용자가 직접 수정할 수 있는 프로필 항목 묶음
public record ProfileFields(
        String name,
        String nip,
        String agency,
        String position,
        String grade,
        String currentRegion,
        String desiredRegion
) {}

package com.asnswap.backend.profile.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.asnswap.backend.profile.domain.ProfileFields;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 프로필 등록/수정 요청
 * - email 필드는 받지 않는다. 저장 대상은 항상 토큰의 email
 *   (바디에 email이 와도 알 수 없는 필드로 무시된다)
 */
public record ProfileRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 100) String name,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Size(max = 30) String nip,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 150) String agency,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 100) String position,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 20) String grade,

        @JsonProperty("current_region")
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 100) String currentRegion,

        @JsonProperty("desired_region")
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 100) String desiredRegion
) {
    public ProfileFields toFields() {
        String nipOrNull = (nip == null || nip.isBlank()) ? null : nip;
        return new ProfileFields(name, nipOrNull, agency, position, grade, currentRegion, desiredRegion);
    }
}

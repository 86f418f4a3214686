package com.asnswap.backend.profile.dto;

import java.time.LocalDateTime;

import com.asnswap.backend.profile.domain.UserProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ProfileResponse(
        String email,
        String name,
        String nip,
        String agency,
        String position,
        String grade,
        @JsonProperty("current_region") String currentRegion,
        @JsonProperty("desired_region") String desiredRegion,
        @JsonProperty("is_subscribed") boolean subscribed,
        @JsonProperty("is_verified") boolean verified,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {
    public static ProfileResponse from(UserProfile p) {
        return new ProfileResponse(
                p.getEmail(),
                p.getName(),
                p.getNip(),
                p.getAgency(),
                p.getPosition(),
                p.getGrade(),
                p.getCurrentRegion(),
                p.getDesiredRegion(),
                p.isSubscribed(),
                p.isVerified(),
                p.getCreatedAt(),
                p.getUpdatedAt());
    }
}

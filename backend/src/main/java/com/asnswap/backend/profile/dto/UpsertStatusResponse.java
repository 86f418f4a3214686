package com.asnswap.backend.profile.dto;

public record UpsertStatusResponse(String status) {

    public static UpsertStatusResponse created() {
        return new UpsertStatusResponse("created");
    }

    public static UpsertStatusResponse updated() {
        return new UpsertStatusResponse("updated");
    }
}

package com.asnswap.backend.admin.dto;

public record AdminStatusResponse(String status) {

    public static AdminStatusResponse ok() {
        return new AdminStatusResponse("ok");
    }

    public static AdminStatusResponse deleted() {
        return new AdminStatusResponse("deleted");
    }
}

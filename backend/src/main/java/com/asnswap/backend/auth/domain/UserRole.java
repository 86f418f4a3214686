package com.asnswap.backend.auth.domain;

public enum UserRole {
    USER,
    ADMIN
}

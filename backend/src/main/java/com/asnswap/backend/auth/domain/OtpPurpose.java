package com.asnswap.backend.auth.domain;

public enum OtpPurpose {
    LOGIN
}

package com.asnswap.backend.profile.dto;

import java.util.List;

public record ProfileSearchResponse(List<ProfileResponse> results) {}

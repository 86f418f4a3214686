package com.asnswap.backend.admin.dto;

import java.util.List;

import com.asnswap.backend.profile.dto.ProfileResponse;

public record AdminUsersResponse(List<ProfileResponse> users) {}

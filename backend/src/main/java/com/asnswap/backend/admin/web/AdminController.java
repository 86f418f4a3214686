package com.asnswap.backend.admin.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.admin.dto.AdminStatusResponse;
import com.asnswap.backend.admin.dto.AdminUsersResponse;
import com.asnswap.backend.admin.dto.AdminVerifyRequest;
import com.asnswap.backend.admin.service.AdminService;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 관리자 API (/api/admin/**)
 * - SecurityConfig에서 ROLE_ADMIN만 통과. 여기서도 principal 역할을 한 번 더 확인한다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin")
public class AdminController {

    private final AdminService adminService;

    @GetMapping("/users")
    public AdminUsersResponse users(@AuthenticationPrincipal AuthPrincipal principal) {
        requireAdmin(principal);
        return new AdminUsersResponse(adminService.listUsers());
    }

    @PostMapping("/verify")
    public AdminStatusResponse verify(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody AdminVerifyRequest req) {
        String admin = requireAdmin(principal);
        adminService.setVerified(admin, req.email(), req.verified());
        return AdminStatusResponse.ok();
    }

    @DeleteMapping("/users/{email}")
    public AdminStatusResponse delete(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable("email") String email) {
        String admin = requireAdmin(principal);
        adminService.deleteUser(admin, email);
        return AdminStatusResponse.deleted();
    }

    private static String requireAdmin(AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.UNAUTHENTICATED);
        }
        if (!principal.isAdmin()) {
            throw new ApiException(ErrorCode.ACCESS_DENIED);
        }
        return principal.email();
    }
}

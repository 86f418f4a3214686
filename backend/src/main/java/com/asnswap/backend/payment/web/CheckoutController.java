package com.asnswap.backend.payment.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.payment.dto.CheckoutRequest;
import com.asnswap.backend.payment.dto.CheckoutResponse;
import com.asnswap.backend.payment.service.CheckoutService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;

    @PostMapping("/session")
    public CheckoutResponse createSession(@Valid @RequestBody CheckoutRequest req) {
        return checkoutService.createSession(req.email());
    }
}

package com.complaintportal.controller;

import com.complaintportal.dto.LoginRequest;
import com.complaintportal.dto.TokenResponse;
import com.complaintportal.service.AdminAuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminAuthController {

    private final AdminAuthService adminAuthService;

    @PostMapping("/login")
    public TokenResponse login(@RequestBody(required = false) LoginRequest request) {
        String password = (request != null) ? request.password() : null;
        return new TokenResponse(adminAuthService.login(password));
    }
}

package com.complaintportal.service;

import com.complaintportal.exception.BusinessException;
import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.security.AdminTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Single shared admin secret; a correct password buys an 8 hour admin token.
 */
@Slf4j
@Service
public class AdminAuthService {

    static final String DEFAULT_PASSWORD = "admin123";
    static final String DEFAULT_SECRET = "supersecret123";

    private final AdminTokenService tokenService;
    private final byte[] adminPassword;

    public AdminAuthService(AdminTokenService tokenService,
                            @Value("${app.admin.password}") String adminPassword,
                            @Value("${app.jwt.secret}") String jwtSecret) {
        this.tokenService = tokenService;
        this.adminPassword = adminPassword.getBytes(StandardCharsets.UTF_8);

        if (DEFAULT_PASSWORD.equals(adminPassword)) {
            log.warn("Using the built-in default admin password; set ADMIN_PASSWORD");
        }
        if (DEFAULT_SECRET.equals(jwtSecret)) {
            log.warn("Using the built-in default token signing secret; set JWT_SECRET");
        }
    }

    public String login(String password) {
        if (password == null || password.isEmpty()
                || !MessageDigest.isEqual(adminPassword, password.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected admin login attempt");
            throw new BusinessException(ErrorMessage.INVALID_ADMIN_PASSWORD);
        }
        log.info("Admin logged in");
        return tokenService.issueAdminToken();
    }
}

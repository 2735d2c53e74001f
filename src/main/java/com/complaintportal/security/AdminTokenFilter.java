package com.complaintportal.security;

import com.complaintportal.exception.ErrorMessage;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Turns a {@code Authorization: Bearer ...} header into an authenticated principal.
 * A verified token without the admin role authenticates with no authorities, so protected
 * routes answer 403 instead of 401.
 */
@Slf4j
public class AdminTokenFilter extends OncePerRequestFilter {

    /** Request attribute read by the entry point to tell "missing" from "invalid". */
    public static final String TOKEN_ERROR_ATTRIBUTE = AdminTokenFilter.class.getName() + ".error";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AdminTokenService tokenService;

    public AdminTokenFilter(AdminTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain chain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (token.isEmpty()) {
                // Treated as no credentials at all
                chain.doFilter(request, response);
                return;
            }
            try {
                AdminTokenClaims claims = tokenService.verify(token);
                List<GrantedAuthority> authorities = claims.isAdmin()
                        ? List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
                        : List.of();
                var authentication = new UsernamePasswordAuthenticationToken(
                        claims.subject() != null ? claims.subject() : "unknown", null, authorities);
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidAdminTokenException e) {
                log.debug("Rejected bearer token: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                request.setAttribute(TOKEN_ERROR_ATTRIBUTE, ErrorMessage.INVALID_TOKEN);
            }
        }
        chain.doFilter(request, response);
    }
}

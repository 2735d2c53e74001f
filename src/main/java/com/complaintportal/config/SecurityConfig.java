package com.complaintportal.config;

import com.complaintportal.security.AdminTokenFilter;
import com.complaintportal.security.AdminTokenService;
import com.complaintportal.security.JsonSecurityErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

@Configuration
public class SecurityConfig {

    private final AdminTokenService adminTokenService;
    private final JsonSecurityErrorHandler securityErrorHandler;

    public SecurityConfig(AdminTokenService adminTokenService,
                          JsonSecurityErrorHandler securityErrorHandler) {
        this.adminTokenService = adminTokenService;
        this.securityErrorHandler = securityErrorHandler;
    }

    // No user accounts: keeps Boot from generating a default user and password
    @Bean
    public UserDetailsService userDetailsService() {
        return new InMemoryUserDetailsManager();
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                // Stateless JSON API: bearer token only, no session, no CSRF, no login forms
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                // CORS rules come from WebConfig
                .cors(Customizer.withDefaults())

                .headers(headers -> headers
                        .contentSecurityPolicy(csp -> csp.policyDirectives("default-src 'self'"))
                        .referrerPolicy(ref -> ref.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER))
                        .frameOptions(frame -> frame.sameOrigin())
                )

                .authorizeHttpRequests(auth -> auth
                        // Admin only
                        .requestMatchers(HttpMethod.PATCH, "/api/complaints/*/status").hasRole("ADMIN")

                        // Public API
                        .requestMatchers(HttpMethod.GET, "/", "/api/complaints").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/admin/login", "/api/complaints",
                                "/api/complaints/*/upvote").permitAll()
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/error").permitAll()

                        // Unknown routes fall through to MVC's 404/405
                        .anyRequest().permitAll()
                )

                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(securityErrorHandler)
                        .accessDeniedHandler(securityErrorHandler)
                )

                .addFilterBefore(new AdminTokenFilter(adminTokenService), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}

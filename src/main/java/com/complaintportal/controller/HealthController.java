package com.complaintportal.controller;

import com.complaintportal.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/")
    public HealthResponse health() {
        return new HealthResponse("ok", "Smart Complaint Portal API running");
    }
}

package com.complaintportal.controller;

import com.complaintportal.dto.CreateComplaintRequest;
import com.complaintportal.dto.StatusUpdateRequest;
import com.complaintportal.model.Complaint;
import com.complaintportal.model.ComplaintStatus;
import com.complaintportal.service.ComplaintService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

// Rate limits are applied by RateLimitInterceptor, admin auth by SecurityConfig
@RestController
@RequestMapping("/api/complaints")
@RequiredArgsConstructor
public class ComplaintController {

    private final ComplaintService complaintService;

    @GetMapping
    public List<Complaint> list() {
        return complaintService.listNewestFirst();
    }

    @PostMapping
    public ResponseEntity<Complaint> create(@Valid @RequestBody CreateComplaintRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(complaintService.create(request));
    }

    @PostMapping("/{id}/upvote")
    public Complaint upvote(@PathVariable String id, HttpServletRequest request) {
        // Raw socket address, same key the rate limiter uses
        return complaintService.upvote(id, request.getRemoteAddr());
    }

    @PatchMapping("/{id}/status")
    public Complaint updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest request) {
        return complaintService.updateStatus(id, ComplaintStatus.fromLabel(request.getStatus()));
    }
}

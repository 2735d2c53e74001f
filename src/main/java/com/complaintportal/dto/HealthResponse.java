package com.complaintportal.dto;

public record HealthResponse(String status, String message) {
}

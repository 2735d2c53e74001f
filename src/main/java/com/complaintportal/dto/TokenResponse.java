package com.complaintportal.dto;

public record TokenResponse(String token) {
}

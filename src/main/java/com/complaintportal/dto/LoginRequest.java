package com.complaintportal.dto;

public record LoginRequest(String password) {
}

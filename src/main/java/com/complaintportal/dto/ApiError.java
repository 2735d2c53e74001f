package com.complaintportal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

// Body of every error response: {message, errors?}
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {

    private final String message;

    @Singular
    private final List<FieldViolation> errors;

    public record FieldViolation(String field, String message) {
    }

    public static ApiError of(String message) {
        return ApiError.builder().message(message).build();
    }
}

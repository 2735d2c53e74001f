package com.complaintportal.dto;

import com.complaintportal.model.IssueType;
import com.complaintportal.validation.CharLength;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class CreateComplaintRequest {

    @CharLength(max = 80, message = "Name must be at most 80 characters")
    private String name;

    @NotNull(message = "Issue type is required")
    @Pattern(regexp = IssueType.LABEL_PATTERN,
            message = "Issue type must be one of Road, Street Light, Water, Garbage, Other")
    private String issueType;

    @NotNull(message = "Title is required")
    @CharLength(min = 5, max = 120, message = "Title must be between 5 and 120 characters")
    private String title;

    @NotNull(message = "Description is required")
    @CharLength(min = 10, max = 1000, message = "Description must be between 10 and 1000 characters")
    private String description;

    @NotNull(message = "Location is required")
    @CharLength(min = 3, max = 200, message = "Location must be between 3 and 200 characters")
    private String location;

    @CharLength(max = 5_000_000, message = "Photo data must be at most 5000000 characters")
    private String photoData;
}

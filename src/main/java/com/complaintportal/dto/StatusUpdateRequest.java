package com.complaintportal.dto;

import com.complaintportal.model.ComplaintStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class StatusUpdateRequest {

    @NotNull(message = "Status is required")
    @Pattern(regexp = ComplaintStatus.LABEL_PATTERN,
            message = "Status must be one of Pending, In Progress, Resolved")
    private String status;
}

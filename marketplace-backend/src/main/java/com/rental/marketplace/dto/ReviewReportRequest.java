package com.rental.marketplace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewReportRequest {

    @NotBlank(message = "Status is required")
    @Pattern(regexp = "confirmed|false_positive|dismissed", message = "Invalid status")
    private String status;

    @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
    private String notes;

    // defaults to none
    @Pattern(regexp = "none|warning|content_removed|user_suspended|user_banned|shadowban", message = "Invalid action")
    private String action;
}

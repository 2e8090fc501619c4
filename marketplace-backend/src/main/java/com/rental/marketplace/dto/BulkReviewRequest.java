package com.rental.marketplace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkReviewRequest {

    @NotEmpty(message = "Report IDs are required")
    @Size(min = 1, max = 50, message = "Between 1 and 50 report IDs are allowed")
    private List<@NotNull Long> reportIds;

    @NotBlank(message = "Status is required")
    @Pattern(regexp = "confirmed|false_positive|dismissed", message = "Invalid status")
    private String status;

    @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
    private String notes;

    @Pattern(regexp = "none|warning|content_removed|user_suspended|user_banned|shadowban", message = "Invalid action")
    private String action;
}

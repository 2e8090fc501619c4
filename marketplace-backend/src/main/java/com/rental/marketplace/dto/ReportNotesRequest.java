package com.rental.marketplace.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of the claim and resolve endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportNotesRequest {

    @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
    private String notes;
}

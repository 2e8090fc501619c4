package com.rental.marketplace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppealRequest {

    @NotBlank(message = "Appeal reason is required")
    @Size(min = 20, max = 1000, message = "Appeal reason must be between 20 and 1000 characters")
    private String reason;
}

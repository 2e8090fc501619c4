package com.rental.marketplace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentCheckRequest {

    @NotBlank(message = "Content type is required")
    @Pattern(regexp = "property|booking", message = "Invalid content type")
    private String contentType;

    @NotNull(message = "Content ID is required")
    private Long contentId;
}

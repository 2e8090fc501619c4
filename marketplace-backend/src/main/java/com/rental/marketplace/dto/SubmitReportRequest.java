package com.rental.marketplace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class SubmitReportRequest {

    @NotBlank(message = "Content type is required")
    @Pattern(regexp = "property|booking|message|user|review", message = "Invalid content type")
    private String contentType;

    @NotNull(message = "Content ID is required")
    private Long contentId;

    @NotBlank(message = "Category is required")
    @Pattern(regexp = "spam|inappropriate|fake_listing|duplicate|misleading|other", message = "Invalid category")
    private String category;

    @NotBlank(message = "Reason is required")
    @Size(min = 10, max = 500, message = "Reason must be between 10 and 500 characters")
    private String reason;

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    private String description;

    // evidence URLs
    private List<@NotBlank(message = "Evidence entries cannot be blank") String> evidence = new ArrayList<>();
}

package com.rental.marketplace.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query parameters of the admin report listing. Every filter is optional.
 */
@Data
@NoArgsConstructor
public class ReportQuery {

    @Min(value = 1, message = "Page must be at least 1")
    private Integer page = 1;

    @Min(value = 1, message = "Limit must be between 1 and 100")
    @Max(value = 100, message = "Limit must be between 1 and 100")
    private Integer limit = 10;

    @Pattern(regexp = "pending|under_review|confirmed|false_positive|resolved|dismissed", message = "Invalid status")
    private String status;

    @Pattern(regexp = "low|medium|high|critical", message = "Invalid severity")
    private String severity;

    @Pattern(regexp = "property|booking|message|user|review", message = "Invalid content type")
    private String contentType;

    @Pattern(regexp = "automated|user_reported|admin_flagged", message = "Invalid report type")
    private String reportType;

    @Min(value = 0, message = "Confidence must be between 0 and 100")
    @Max(value = 100, message = "Confidence must be between 0 and 100")
    private Integer minConfidence;

    @Min(value = 0, message = "Confidence must be between 0 and 100")
    @Max(value = 100, message = "Confidence must be between 0 and 100")
    private Integer maxConfidence;

    @Pattern(regexp = "reportedAt|priority|severity|status|resolvedAt", message = "Invalid sort field")
    private String sortBy = "reportedAt";

    @Pattern(regexp = "asc|desc", message = "Sort order must be asc or desc")
    private String sortOrder = "desc";
}

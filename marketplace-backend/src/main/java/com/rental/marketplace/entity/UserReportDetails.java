package com.rental.marketplace.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What the reporter wrote when filing a user report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class UserReportDetails {

    @Column(name = "report_reason", length = 500)
    private String reason;

    @Column(name = "report_description", length = 1000)
    private String description;

    // evidence URLs
    @Convert(converter = StringListConverter.class)
    @Column(name = "report_evidence", length = 2000)
    private List<String> evidence;

    public List<String> getEvidence() {
        return evidence == null ? List.of() : evidence;
    }
}

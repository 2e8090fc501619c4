package com.rental.marketplace.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Moderation dashboard figures for one period.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpamStatisticsDTO implements Serializable {
    private String period;
    private Long totalReports;
    // status value -> count
    private Map<String, Long> reportsByStatus;
    // report type value -> count
    private Map<String, Long> reportsByType;
    private Double averageConfidence;
    private List<TopReportedUserDTO> topReportedUsers;
}

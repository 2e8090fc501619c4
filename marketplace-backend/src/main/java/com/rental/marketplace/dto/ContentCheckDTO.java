package com.rental.marketplace.dto;

import com.rental.marketplace.enums.ContentType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentCheckDTO implements Serializable {
    private ContentType contentType;
    private Long contentId;
    private Long authorId;
    // the text fields that were scored
    private Map<String, String> content;
    private DetectionResultDTO spamDetection;
    private DetectionSummaryDTO summary;
}

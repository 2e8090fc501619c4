package com.rental.marketplace.service;

import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.dto.ContentCheckDTO;
import com.rental.marketplace.dto.ContentCheckRequest;
import com.rental.marketplace.dto.DetectionResultDTO;
import com.rental.marketplace.dto.DetectionSummaryDTO;
import com.rental.marketplace.entity.ContentItem;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.exception.NotFoundException;
import com.rental.marketplace.exception.ValidationException;
import org.springframework.stereotype.Service;

@Service
public class ContentCheckServiceImpl implements ContentCheckService {

    private final ContentLocator contentLocator;
    private final SpamDetectionService spamDetectionService;

    public ContentCheckServiceImpl(ContentLocator contentLocator, SpamDetectionService spamDetectionService) {
        this.contentLocator = contentLocator;
        this.spamDetectionService = spamDetectionService;
    }

    @Override
    public ContentCheckDTO checkContent(ContentCheckRequest request) {
        ContentType type = ContentType.fromValue(request.getContentType());
        if (!type.isFrequencyTracked()) {
            throw ValidationException.of("contentType", "Invalid content type");
        }

        ContentItem item = contentLocator.find(type, request.getContentId())
                .orElseThrow(() -> new NotFoundException("Content not found"));

        DetectionResult result = spamDetectionService.detectSpam(DetectionSubject.of(item));
        return new ContentCheckDTO(type, item.getContentId(), item.getAuthorId(), item.textFields(),
                DetectionResultDTO.from(result), DetectionSummaryDTO.from(result));
    }
}

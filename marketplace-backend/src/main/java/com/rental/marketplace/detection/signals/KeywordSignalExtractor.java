package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.detection.SignalExtractor;
import com.rental.marketplace.enums.SignalCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Risky vocabulary. Each scanned field is scored on its own (capped at 1.0) and the signal is the
 * mean over the fields that are present.
 */
@Component
public class KeywordSignalExtractor implements SignalExtractor {

    private final SpamDetectionProperties.Keywords keywords;
    private final List<String> scannedFields;

    public KeywordSignalExtractor(SpamDetectionProperties properties) {
        this.keywords = properties.getKeywords();
        this.scannedFields = List.copyOf(properties.getScannedFields());
    }

    @Override
    public SignalCategory category() {
        return SignalCategory.KEYWORD;
    }

    @Override
    public double score(DetectionSubject subject) {
        double total = 0.0;
        int fieldCount = 0;
        for (String field : scannedFields) {
            String value = subject.getFields().get(field);
            if (value == null || value.isEmpty()) {
                continue;
            }
            total += Math.min(fieldScore(value.toLowerCase(Locale.ROOT)), 1.0);
            fieldCount++;
        }
        return fieldCount > 0 ? total / fieldCount : 0.0;
    }

    private double fieldScore(String text) {
        return keywords.getHighPenalty() * matches(text, keywords.getHigh())
                + keywords.getMediumPenalty() * matches(text, keywords.getMedium())
                + keywords.getLowPenalty() * matches(text, keywords.getLow());
    }

    // each keyword counts once per field
    private static int matches(String text, List<String> list) {
        int count = 0;
        for (String keyword : list) {
            if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                count++;
            }
        }
        return count;
    }
}

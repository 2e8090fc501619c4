package com.rental.marketplace.detection;

import com.rental.marketplace.entity.ContentItem;
import com.rental.marketplace.enums.ContentType;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a detection run looks at: the text fields of one piece of content and who wrote it.
 */
@Getter
@ToString
public final class DetectionSubject {

    private final ContentType contentType;
    // null for drafts that were not saved yet
    private final Long contentId;
    private final Long userId;
    private final Map<String, String> fields;

    public DetectionSubject(ContentType contentType, Long contentId, Long userId, Map<String, String> fields) {
        this.contentType = contentType;
        this.contentId = contentId;
        this.userId = userId;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public static DetectionSubject of(ContentItem item) {
        return new DetectionSubject(item.getContentType(), item.getContentId(), item.getAuthorId(), item.textFields());
    }

    public static DetectionSubject draft(ContentType contentType, Long userId, Map<String, String> fields) {
        return new DetectionSubject(contentType, null, userId, fields);
    }

    /**
     * All non-null field values joined by a single space.
     */
    public String textBlob() {
        StringBuilder blob = new StringBuilder();
        for (String value : fields.values()) {
            if (value == null) {
                continue;
            }
            if (blob.length() > 0) {
                blob.append(' ');
            }
            blob.append(value);
        }
        return blob.toString();
    }
}

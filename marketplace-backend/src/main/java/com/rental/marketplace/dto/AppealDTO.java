package com.rental.marketplace.dto;

import com.rental.marketplace.entity.ReportAppeal;
import com.rental.marketplace.enums.AppealStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppealDTO implements Serializable {
    private boolean submitted;
    private LocalDateTime submittedAt;
    private String reason;
    private AppealStatus status;
    private Long reviewedBy;
    private LocalDateTime reviewedAt;
    private String reviewNotes;

    public static AppealDTO from(ReportAppeal appeal) {
        return new AppealDTO(appeal.isSubmitted(), appeal.getSubmittedAt(), appeal.getReason(), appeal.getStatus(),
                appeal.getReviewedBy(), appeal.getReviewedAt(), appeal.getReviewNotes());
    }
}

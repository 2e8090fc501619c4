package com.rental.marketplace.controller;

import com.rental.marketplace.dto.CommonResponse;
import com.rental.marketplace.dto.ContentCheckDTO;
import com.rental.marketplace.dto.ContentCheckRequest;
import com.rental.marketplace.dto.SpamStatisticsDTO;
import com.rental.marketplace.filter.AuthenticatedActor;
import com.rental.marketplace.service.ContentCheckService;
import com.rental.marketplace.service.SpamStatisticsService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Moderator tooling: dashboard statistics and on-demand content checks. Admin only.
 */
@RestController
@RequestMapping("/api/spam")
public class SpamStatisticsController {

    private final SpamStatisticsService spamStatisticsService;
    private final ContentCheckService contentCheckService;

    public SpamStatisticsController(SpamStatisticsService spamStatisticsService,
                                    ContentCheckService contentCheckService) {
        this.spamStatisticsService = spamStatisticsService;
        this.contentCheckService = contentCheckService;
    }

    /**
     * GET /api/spam/statistics?period=7d
     */
    @GetMapping("/statistics")
    public ResponseEntity<CommonResponse<SpamStatisticsDTO>> getStatistics(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @RequestParam(value = "period", required = false) String period) {
        actor.requireAdmin();
        return ResponseEntity.ok(CommonResponse.success(spamStatisticsService.getStatistics(period)));
    }

    @PostMapping("/check-content")
    public ResponseEntity<CommonResponse<ContentCheckDTO>> checkContent(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @Valid @RequestBody ContentCheckRequest request) {
        actor.requireAdmin();
        return ResponseEntity.ok(CommonResponse.success(contentCheckService.checkContent(request)));
    }
}

package com.rental.marketplace.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rental.marketplace.entity.*;
import com.rental.marketplace.enums.*;
import com.rental.marketplace.filter.AuthenticatedActor;
import com.rental.marketplace.repository.BookingRepository;
import com.rental.marketplace.repository.PropertyRepository;
import com.rental.marketplace.repository.SpamReportRepository;
import com.rental.marketplace.repository.UserRepository;
import com.rental.marketplace.service.ContentSubmissionGate;
import com.rental.marketplace.service.GateDecision;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end moderation flows against an in-memory database: reporting, review with enforcement,
 * appeals, bulk review, statistics, manual content checks and the submission gate.
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Marketplace moderation integration test")
class MarketplaceIntegrationTest {

    private static final String SPAM_TITLE = "URGENT!!! Congratulations winner, wire transfer, cash only";
    private static final String SPAM_DESCRIPTION = "Guaranteed winner lottery, act now, cash only. "
            + "Call +1 555-123-4567 or email win@scam.com http://bit.ly/xyz";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PropertyRepository propertyRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private SpamReportRepository spamReportRepository;

    @Autowired
    private ContentSubmissionGate submissionGate;

    private User admin;
    private User reporter;
    private User owner;
    private Property listing;

    @BeforeEach
    void setUp() {
        spamReportRepository.deleteAll();
        bookingRepository.deleteAll();
        propertyRepository.deleteAll();
        userRepository.deleteAll();

        admin = saveUser("Admin", UserRole.ADMIN, LocalDateTime.now().minusYears(1), true);
        reporter = saveUser("Reporter", UserRole.USER, LocalDateTime.now().minusDays(90), true);
        owner = saveUser("Owner", UserRole.USER, LocalDateTime.now().minusDays(60), true);
        listing = saveProperty(owner, "Sunny loft downtown", "Two rooms, close to the park.",
                LocalDateTime.now().minusDays(2));
        log.info("Fixture ready: admin={}, reporter={}, owner={}, listing={}",
                admin.getUserId(), reporter.getUserId(), owner.getUserId(), listing.getPropertyId());
    }

    private User saveUser(String name, UserRole role, LocalDateTime createdAt, boolean completeProfile) {
        User user = new User();
        user.setRole(role);
        user.setCreatedAt(createdAt);
        if (completeProfile) {
            user.setName(name);
            user.setEmail(name.toLowerCase() + "@example.com");
            user.setPhone("555-0100");
            user.setAvatar("avatar.png");
        }
        return userRepository.save(user);
    }

    private Property saveProperty(User author, String title, String description, LocalDateTime createdAt) {
        Property property = new Property();
        property.setOwnerId(author.getUserId());
        property.setTitle(title);
        property.setDescription(description);
        property.setCreatedAt(createdAt);
        return propertyRepository.save(property);
    }

    private SpamReport saveReport(User reported, ReportStatus status, LocalDateTime reportedAt) {
        SpamReport report = new SpamReport();
        report.setContentType(ContentType.PROPERTY);
        report.setContentId(listing.getPropertyId());
        report.setReporterId(reporter.getUserId());
        report.setReportedUserId(reported.getUserId());
        report.setReportType(ReportType.USER_REPORTED);
        report.setCategory(ReportCategory.SPAM);
        report.setSeverity(Severity.MEDIUM);
        report.setUserReportDetails(new UserReportDetails("Looks like a scam listing", null, new ArrayList<>()));
        report.setReportedAt(reportedAt);
        if (status != ReportStatus.PENDING) {
            report.transitionTo(status, reportedAt.plusHours(1));
        }
        return spamReportRepository.save(report);
    }

    /** A day-old account with an empty profile and three confirmed reports. */
    private User riskyUser() {
        User user = saveUser(null, UserRole.USER, LocalDateTime.now().minusHours(2), false);
        for (int i = 0; i < 3; i++) {
            saveReport(user, ReportStatus.CONFIRMED, LocalDateTime.now().minusDays(3));
        }
        return user;
    }

    private MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, User actor) {
        return request
                .header("X-User-Id", actor.getUserId())
                .header("X-User-Role", actor.getRole().getValue())
                .contentType(MediaType.APPLICATION_JSON);
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode data(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("data");
    }

    @Test
    @DisplayName("Requests without an actor are rejected")
    void testMissingActor() throws Exception {
        mockMvc.perform(get("/api/spam/reports"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(401))
                .andExpect(jsonPath("$.message").value("Authentication required"));
    }

    @Test
    @DisplayName("User report is filed once per reporter")
    void testSubmitReportAndDuplicateGuard() throws Exception {
        Map<String, Object> body = Map.of(
                "contentType", "property",
                "contentId", listing.getPropertyId(),
                "category", "fake_listing",
                "reason", "Photos are copied from another site",
                "evidence", List.of("https://example.com/original"));

        mockMvc.perform(as(post("/api/spam/report"), reporter).content(json(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.reportType").value("user_reported"))
                .andExpect(jsonPath("$.data.severity").value("high"))
                .andExpect(jsonPath("$.data.priority").value(7))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.reportedUserId").value(owner.getUserId()));

        mockMvc.perform(as(post("/api/spam/report"), reporter).content(json(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("You have already reported this content"));

        assertThat(spamReportRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Invalid report requests list the offending fields")
    void testSubmitReportValidation() throws Exception {
        Map<String, Object> body = Map.of(
                "contentType", "property",
                "contentId", listing.getPropertyId(),
                "category", "spam",
                "reason", "short");

        mockMvc.perform(as(post("/api/spam/report"), reporter).content(json(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("reason"));

        Map<String, Object> missing = Map.of(
                "contentType", "property",
                "contentId", 999999,
                "category", "spam",
                "reason", "Nothing here but still reported");

        mockMvc.perform(as(post("/api/spam/report"), reporter).content(json(missing)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Content not found"));
    }

    @Test
    @DisplayName("Only admins can list and review reports")
    void testAdminOnlyEndpoints() throws Exception {
        mockMvc.perform(as(get("/api/spam/reports"), reporter))
                .andExpect(status().isForbidden());

        saveReport(owner, ReportStatus.PENDING, LocalDateTime.now().minusHours(1));

        mockMvc.perform(as(get("/api/spam/reports"), admin).param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalDocs").value(1))
                .andExpect(jsonPath("$.data.page").value(1));

        mockMvc.perform(as(get("/api/spam/reports"), admin).param("limit", "500"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Confirming a report applies the chosen action once")
    void testReviewAppliesEnforcement() throws Exception {
        SpamReport report = saveReport(owner, ReportStatus.PENDING, LocalDateTime.now().minusHours(1));
        Map<String, Object> review = Map.of("status", "confirmed", "notes", "Scam", "action", "user_suspended");

        mockMvc.perform(as(put("/api/spam/reports/" + report.getReportId() + "/review"), admin).content(json(review)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("confirmed"))
                .andExpect(jsonPath("$.data.actionTaken").value("user_suspended"))
                .andExpect(jsonPath("$.data.reviewedBy").value(admin.getUserId()));

        User suspended = userRepository.findById(owner.getUserId()).orElseThrow();
        assertThat(suspended.getStatus()).isEqualTo(UserStatus.SUSPENDED);
        assertThat(suspended.getSuspendedUntil()).isAfter(LocalDateTime.now().plusDays(6));

        Map<String, Object> again = Map.of("status", "dismissed");
        mockMvc.perform(as(put("/api/spam/reports/" + report.getReportId() + "/review"), admin).content(json(again)))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Reported user appeals once and an approval reverses the report")
    void testAppealFlow() throws Exception {
        SpamReport report = saveReport(owner, ReportStatus.CONFIRMED, LocalDateTime.now().minusDays(1));
        Map<String, Object> appeal = Map.of("reason", "The listing is mine and every photo is original.");
        String appealUrl = "/api/spam/reports/" + report.getReportId() + "/appeal";

        mockMvc.perform(as(post(appealUrl), reporter).content(json(appeal)))
                .andExpect(status().isForbidden());

        mockMvc.perform(as(post(appealUrl), owner).content(json(appeal)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.appeal.submitted").value(true))
                .andExpect(jsonPath("$.data.appeal.status").value("pending"));

        mockMvc.perform(as(post(appealUrl), owner).content(json(appeal)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Appeal already submitted"));

        MvcResult result = mockMvc.perform(as(put(appealUrl + "/review"), admin)
                        .content(json(Map.of("status", "approved", "notes", "Verified ownership"))))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode reviewed = data(result);
        assertThat(reviewed.get("status").asText()).isEqualTo("false_positive");
        assertThat(reviewed.get("resolvedAt").isNull()).isFalse();
        assertThat(reviewed.get("appeal").get("status").asText()).isEqualTo("approved");
    }

    @Test
    @DisplayName("Bulk review reports per-item success")
    void testBulkReview() throws Exception {
        SpamReport first = saveReport(owner, ReportStatus.PENDING, LocalDateTime.now().minusHours(3));
        SpamReport second = saveReport(owner, ReportStatus.PENDING, LocalDateTime.now().minusHours(2));
        Map<String, Object> body = Map.of(
                "reportIds", List.of(first.getReportId(), second.getReportId(), 999999L),
                "status", "dismissed");

        mockMvc.perform(as(put("/api/spam/reports/bulk-review"), admin).content(json(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.successful").value(2))
                .andExpect(jsonPath("$.data.failed").value(1));

        assertThat(spamReportRepository.findById(first.getReportId()).orElseThrow().getStatus())
                .isEqualTo(ReportStatus.DISMISSED);
    }

    @Test
    @DisplayName("Statistics accept only the known periods")
    void testStatistics() throws Exception {
        saveReport(owner, ReportStatus.PENDING, LocalDateTime.now().minusHours(1));
        saveReport(owner, ReportStatus.CONFIRMED, LocalDateTime.now().minusDays(2));

        mockMvc.perform(as(get("/api/spam/statistics"), admin).param("period", "7d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.period").value("7d"))
                .andExpect(jsonPath("$.data.totalReports").value(2))
                .andExpect(jsonPath("$.data.reportsByStatus.pending").value(1))
                .andExpect(jsonPath("$.data.topReportedUsers[0].userId").value(owner.getUserId()));

        mockMvc.perform(as(get("/api/spam/statistics"), admin).param("period", "2d"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Manual check flags an obvious scam listing")
    void testCheckContent() throws Exception {
        User scammer = riskyUser();
        Property scam = saveProperty(scammer, SPAM_TITLE, SPAM_DESCRIPTION, LocalDateTime.now());

        Map<String, Object> body = Map.of("contentType", "property", "contentId", scam.getPropertyId());
        mockMvc.perform(as(post("/api/spam/check-content"), admin).content(json(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authorId").value(scammer.getUserId()))
                .andExpect(jsonPath("$.data.spamDetection.isSpam").value(true))
                .andExpect(jsonPath("$.data.spamDetection.confidence").value(80))
                .andExpect(jsonPath("$.data.summary.summary").value("SPAM DETECTED - 80% confidence"));

        // the run also filed an automated report against the listing
        assertThat(spamReportRepository.findByContentTypeAndContentId(ContentType.PROPERTY, scam.getPropertyId()))
                .singleElement()
                .satisfies(report -> {
                    assertThat(report.getReportType()).isEqualTo(ReportType.AUTOMATED);
                    assertThat(report.getSeverity()).isEqualTo(Severity.HIGH);
                });
    }

    @Test
    @DisplayName("Submission gate refuses a flood of scam listings")
    void testGateRejectsSpamBurst() {
        User scammer = riskyUser();
        for (int i = 0; i < 15; i++) {
            saveProperty(scammer, "Listing " + i, "Flat", LocalDateTime.now().minusHours(5));
        }
        for (int i = 0; i < 6; i++) {
            saveProperty(scammer, "Recent " + i, "Flat", LocalDateTime.now().minusMinutes(10));
        }

        GateDecision decision = submissionGate.screen(AuthenticatedActor.user(scammer.getUserId()),
                ContentType.PROPERTY, Map.of("title", SPAM_TITLE, "description", SPAM_DESCRIPTION));

        assertThat(decision.getAction()).isEqualTo(SpamAction.AUTO_REJECT);
        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getDetectionResult().getConfidence()).isEqualTo(94);

        SpamReport report = spamReportRepository.findById(decision.getReportId()).orElseThrow();
        assertThat(report.getReportType()).isEqualTo(ReportType.AUTOMATED);
        assertThat(report.getContentId()).isNull();
        assertThat(report.getPriority()).isEqualTo(9);
    }

    @Test
    @DisplayName("Submission gate lets ordinary listings through")
    void testGateApprovesCleanListing() {
        GateDecision decision = submissionGate.screen(AuthenticatedActor.user(owner.getUserId()),
                ContentType.PROPERTY, Map.of("title", "Bright two bedroom flat",
                        "description", "Quiet street with a garden view"));

        assertThat(decision.getAction()).isEqualTo(SpamAction.AUTO_APPROVE);
        assertThat(decision.getReportId()).isNull();

        Property saved = saveProperty(owner, "Bright two bedroom flat", "Quiet street with a garden view",
                LocalDateTime.now());
        submissionGate.completeSubmission(decision, saved);

        assertThat(propertyRepository.findById(saved.getPropertyId()).orElseThrow().getStatus())
                .isEqualTo(PropertyStatus.ACTIVE);
        assertThat(spamReportRepository.count()).isZero();
    }
}

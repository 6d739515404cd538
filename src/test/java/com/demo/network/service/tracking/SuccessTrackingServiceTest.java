package com.demo.network.service.tracking;

import com.demo.network.exception.ConflictException;
import com.demo.network.exception.NotFoundException;
import com.demo.network.exception.ValidationException;
import com.demo.network.model.ActualOutcome;
import com.demo.network.model.LearningSignal;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OutcomeMetadata;
import com.demo.network.support.Fixtures;
import com.demo.network.support.InMemoryFeedbackRepository;
import com.demo.network.support.InMemoryOpportunityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.demo.network.support.Fixtures.ACCOUNT;
import static com.demo.network.support.Fixtures.NOW;
import static com.demo.network.support.Fixtures.daysAgo;
import static com.demo.network.support.Fixtures.suggestion;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SuccessTrackingService")
class SuccessTrackingServiceTest {

    private InMemoryOpportunityRepository opportunities;
    private InMemoryFeedbackRepository feedback;
    private SuccessTrackingService service;

    @BeforeEach
    void setUp() {
        opportunities = new InMemoryOpportunityRepository();
        feedback = new InMemoryFeedbackRepository();
        service = new SuccessTrackingService(opportunities, feedback, Fixtures.clock());
    }

    private static FeedbackCommand cmd(String id, int rating, ActualOutcome outcome, double impact) {
        return new FeedbackCommand(id, "user-1", rating, outcome, impact, 2.5, null);
    }

    @Nested
    @DisplayName("recordFeedback()")
    class RecordFeedback {

        @Test
        @DisplayName("rating 5, SUCCESS and 90 against a predicted 80 is a success")
        void success() {
            opportunities.add(suggestion("s1").status(OpportunityStatus.ACCEPTED).impactScore(80).build());

            LearningSignal signal = service.recordFeedback(cmd("s1", 5, ActualOutcome.SUCCESS, 90));

            assertTrue(signal.success());
            assertEquals(80, signal.predictedImpact());
            assertEquals(90, signal.actualImpact());
            OpportunitySuggestion closed = opportunities.findById("s1").orElseThrow();
            assertEquals(OpportunityStatus.COMPLETED, closed.status());
            assertEquals(NOW, closed.completedAt());
            assertTrue(closed.outcome().success());
            assertTrue(feedback.findByOpportunity("s1").isPresent());
        }

        @Test
        @DisplayName("an impact under 80% of the prediction is not a success")
        void lowImpact_notSuccess() {
            assertFalse(SuccessTrackingService.isSuccess(5, ActualOutcome.SUCCESS, 63, 80));
            assertTrue(SuccessTrackingService.isSuccess(4, ActualOutcome.SUCCESS, 65, 80));
            assertFalse(SuccessTrackingService.isSuccess(3, ActualOutcome.SUCCESS, 100, 80));
            assertFalse(SuccessTrackingService.isSuccess(5, ActualOutcome.PARTIAL_SUCCESS, 100, 80));
        }

        @Test
        @DisplayName("feedback on a pending suggestion also stamps actedAt")
        void pending_closedDirectly() {
            opportunities.add(suggestion("s1").build());

            service.recordFeedback(cmd("s1", 2, ActualOutcome.NO_RESULT, 0));

            OpportunitySuggestion closed = opportunities.findById("s1").orElseThrow();
            assertEquals(OpportunityStatus.COMPLETED, closed.status());
            assertEquals(NOW, closed.actedAt());
        }

        @Test
        @DisplayName("terminal suggestions keep their status")
        void rejected_keepsStatus() {
            opportunities.add(suggestion("s1").status(OpportunityStatus.REJECTED).build());

            service.recordFeedback(cmd("s1", 1, ActualOutcome.NEGATIVE, 0));

            assertEquals(OpportunityStatus.REJECTED, opportunities.findById("s1").orElseThrow().status());
        }

        @Test
        @DisplayName("second feedback is a conflict")
        void duplicate_conflict() {
            opportunities.add(suggestion("s1").build());
            service.recordFeedback(cmd("s1", 4, ActualOutcome.SUCCESS, 80));

            assertThrows(ConflictException.class, () -> service.recordFeedback(cmd("s1", 5, ActualOutcome.SUCCESS, 90)));
        }

        @Test
        @DisplayName("invalid input is rejected before anything is written")
        void validation() {
            opportunities.add(suggestion("s1").build());

            assertThrows(ValidationException.class, () -> service.recordFeedback(cmd("s1", 6, ActualOutcome.SUCCESS, 50)));
            assertThrows(ValidationException.class, () -> service.recordFeedback(cmd("s1", 3, ActualOutcome.SUCCESS, 101)));
            assertThrows(ValidationException.class, () -> service.recordFeedback(cmd("s1", 3, null, 50)));
            assertThrows(ValidationException.class, () -> service.recordFeedback(
                    new FeedbackCommand("s1", "u", 3, ActualOutcome.SUCCESS, 50, -1, null)));
            assertEquals(OpportunityStatus.PENDING, opportunities.findById("s1").orElseThrow().status());
        }

        @Test
        @DisplayName("a status change landing between read and close is a conflict and writes no feedback")
        void concurrentClose_conflict() {
            InMemoryOpportunityRepository racing = new InMemoryOpportunityRepository() {
                @Override
                public boolean updateStatus(String id, OpportunityStatus expected, OpportunityStatus next,
                                            Instant actedAt, Instant completedAt) {
                    super.updateStatus(id, expected, OpportunityStatus.REJECTED, actedAt, null);
                    return super.updateStatus(id, expected, next, actedAt, completedAt);
                }
            };
            racing.add(suggestion("s1").build());
            SuccessTrackingService racingService = new SuccessTrackingService(racing, feedback, Fixtures.clock());

            assertThrows(ConflictException.class,
                    () -> racingService.recordFeedback(cmd("s1", 5, ActualOutcome.SUCCESS, 90)));

            assertTrue(feedback.findByOpportunity("s1").isEmpty());
            OpportunitySuggestion row = racing.findById("s1").orElseThrow();
            assertEquals(OpportunityStatus.REJECTED, row.status());
            assertNull(row.outcome());
        }

        @Test
        void unknown_notFound() {
            assertThrows(NotFoundException.class, () -> service.recordFeedback(cmd("nope", 3, ActualOutcome.SUCCESS, 50)));
        }
    }

    @Nested
    @DisplayName("computeMetrics()")
    class Metrics {

        @Test
        @DisplayName("expired suggestions are counted but not part of the rates")
        void expired_excludedFromDenominator() {
            opportunities.add(
                    suggestion("a").status(OpportunityStatus.ACCEPTED).actedAt(daysAgo(0)).build(),
                    suggestion("b").status(OpportunityStatus.VIEWED).build(),
                    suggestion("c").status(OpportunityStatus.EXPIRED).build(),
                    suggestion("old").createdAt(daysAgo(60)).build());

            SuccessMetrics m = service.computeMetrics(ACCOUNT, 30);

            assertEquals(3, m.totalSuggestions());
            assertEquals(2, m.consideredSuggestions());
            assertEquals(50.0, m.acceptanceRate());
            assertEquals(100.0, m.viewRate());
            assertEquals(0.0, m.completionRate());
            assertEquals(1, m.actedCount());
            assertEquals(1.0, m.averageTimeToActionDays());
        }

        @Test
        @DisplayName("success rates are grouped by category")
        void successRateByCategory() {
            opportunities.add(
                    closed("r1", OpportunityCategory.RECONNECTION, true),
                    closed("r2", OpportunityCategory.RECONNECTION, false),
                    closed("i1", OpportunityCategory.INTRODUCTION, true));

            SuccessMetrics m = service.computeMetrics(ACCOUNT, 30);

            assertEquals(50.0, m.successRateByCategory().get("RECONNECTION"));
            assertEquals(100.0, m.successRateByCategory().get("INTRODUCTION"));
            assertEquals(100.0, m.completionRate());
            assertEquals(3, m.closedWithOutcome());
        }

        @Test
        @DisplayName("an empty window gives zeros")
        void empty() {
            SuccessMetrics m = service.computeMetrics(ACCOUNT, 30);

            assertEquals(0, m.consideredSuggestions());
            assertEquals(0.0, m.acceptanceRate());
            assertEquals(0.0, m.userEngagementScore());
        }

        @Test
        void windowMustBePositive() {
            assertThrows(ValidationException.class, () -> service.computeMetrics(ACCOUNT, 0));
        }

        private OpportunitySuggestion closed(String id, OpportunityCategory category, boolean success) {
            return suggestion(id)
                    .category(category)
                    .priority(OpportunityPriority.MEDIUM)
                    .status(OpportunityStatus.COMPLETED)
                    .actedAt(daysAgo(1))
                    .completedAt(NOW)
                    .outcome(new OutcomeMetadata(success ? ActualOutcome.SUCCESS : ActualOutcome.NO_RESULT,
                            success ? 5 : 2, success ? 80 : 10, success))
                    .build();
        }
    }

    @Test
    @DisplayName("accuracy helpers")
    void accuracy() {
        OpportunitySuggestion confidentHit = suggestion("a").confidenceScore(0.9).impactScore(80)
                .outcome(new OutcomeMetadata(ActualOutcome.SUCCESS, 5, 80, true)).build();
        OpportunitySuggestion confidentMiss = suggestion("b").confidenceScore(0.8).impactScore(50)
                .outcome(new OutcomeMetadata(ActualOutcome.NO_RESULT, 2, 0, false)).build();

        assertEquals(0.5, SuccessTrackingService.confidenceAccuracy(List.of(confidentHit, confidentMiss)));
        assertEquals(0.5, SuccessTrackingService.impactAccuracy(List.of(confidentHit, confidentMiss)));
        assertEquals(0.0, SuccessTrackingService.impactAccuracy(List.of(confidentMiss)));
        assertEquals(2.5, SuccessTrackingService.median(List.of(4.0, 1.0, 2.0, 3.0)));
        assertEquals(0.0, SuccessTrackingService.median(List.of()));
    }

    @Test
    @DisplayName("time to action is measured from creation")
    void timeToAction() {
        opportunities.add(suggestion("a").createdAt(daysAgo(4)).status(OpportunityStatus.ACCEPTED)
                .actedAt(daysAgo(4).plus(Duration.ofHours(36))).build());

        assertEquals(1.5, service.computeMetrics(ACCOUNT, 30).medianTimeToActionDays());
    }
}

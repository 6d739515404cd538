package com.demo.network.service.notification;

import com.demo.network.model.NotificationSettings;
import com.demo.network.model.NotificationType;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static com.demo.network.support.Fixtures.ACCOUNT;
import static com.demo.network.support.Fixtures.NOW;
import static com.demo.network.support.Fixtures.suggestion;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotificationPolicy")
class NotificationPolicyTest {

    private static final Predicate<String> NOTHING_SENT = key -> false;
    private static final Duration WINDOW = Duration.ofDays(3);

    private final NotificationPolicy policy = new NotificationPolicy();
    private final NotificationSettings settings = NotificationSettings.defaults("u1", ACCOUNT);

    private static OpportunitySuggestion urgent() {
        return suggestion("u").priority(OpportunityPriority.URGENT).confidenceScore(0.95).impactScore(95).build();
    }

    private static OpportunitySuggestion high() {
        return suggestion("h").priority(OpportunityPriority.HIGH).confidenceScore(0.8).impactScore(85).build();
    }

    private static OpportunitySuggestion medium() {
        return suggestion("m").priority(OpportunityPriority.MEDIUM).confidenceScore(0.6).impactScore(70).build();
    }

    private static OpportunitySuggestion low() {
        return suggestion("l").priority(OpportunityPriority.LOW).confidenceScore(0.5).impactScore(65).build();
    }

    @Nested
    @DisplayName("plan()")
    class Plan {

        @Test
        @DisplayName("urgent items alert alone, high and medium are bundled, low is skipped")
        void partitions() {
            List<PlannedNotification> plan = policy.plan(List.of(low(), medium(), urgent(), high()), List.of(),
                    settings, NOTHING_SENT, WINDOW, NOW);

            assertEquals(2, plan.size());
            PlannedNotification alert = plan.get(0);
            assertEquals(NotificationType.URGENT_OPPORTUNITY, alert.notification().type());
            assertEquals(List.of("u"), alert.notification().opportunityIds());
            assertEquals(List.of("alert:u"), alert.deliveryKeys());

            PlannedNotification bundle = plan.get(1);
            assertEquals(NotificationType.NEW_OPPORTUNITY, bundle.notification().type());
            assertEquals("2 New High-Priority Opportunities", bundle.notification().title());
            assertEquals(List.of("h", "m"), bundle.notification().opportunityIds());
            assertEquals(OpportunityPriority.HIGH, bundle.notification().priority());
        }

        @Test
        @DisplayName("thresholds, categories and status filter what is sent")
        void filters() {
            OpportunitySuggestion weak = suggestion("w").priority(OpportunityPriority.HIGH).confidenceScore(0.3).build();
            OpportunitySuggestion expansion = suggestion("x").priority(OpportunityPriority.HIGH)
                    .category(OpportunityCategory.NETWORK_EXPANSION).build();
            OpportunitySuggestion dismissed = suggestion("d").priority(OpportunityPriority.URGENT)
                    .status(OpportunityStatus.REJECTED).build();
            OpportunitySuggestion expired = suggestion("e").priority(OpportunityPriority.URGENT)
                    .expiresAt(NOW.minusSeconds(1)).build();

            assertTrue(policy.plan(List.of(weak, expansion, dismissed, expired), List.of(),
                    settings, NOTHING_SENT, WINDOW, NOW).isEmpty());
        }

        @Test
        @DisplayName("urgent-only users get no bundle")
        void urgentOnly() {
            NotificationSettings urgentOnly = settings.toBuilder().urgentOnly(true).build();

            List<PlannedNotification> plan = policy.plan(List.of(urgent(), high()), List.of(),
                    urgentOnly, NOTHING_SENT, WINDOW, NOW);

            assertEquals(1, plan.size());
            assertEquals(NotificationType.URGENT_OPPORTUNITY, plan.get(0).notification().type());
        }

        @Test
        @DisplayName("real-time alerts off silences new-opportunity alerts")
        void alertsOff() {
            NotificationSettings off = settings.toBuilder().realTimeAlerts(false).build();

            assertTrue(policy.plan(List.of(urgent(), high()), List.of(urgent()), off, NOTHING_SENT, WINDOW, NOW).isEmpty());
        }

        @Test
        @DisplayName("real-time alerts off still sends expiry reminders")
        void alertsOff_expiringStillSent() {
            NotificationSettings off = settings.toBuilder().realTimeAlerts(false).build();
            OpportunitySuggestion soon = suggestion("soon").priority(OpportunityPriority.URGENT)
                    .expiresAt(NOW.plus(Duration.ofDays(1))).build();

            List<PlannedNotification> plan = policy.plan(List.of(soon), List.of(soon), off, NOTHING_SENT, WINDOW, NOW);

            assertEquals(1, plan.size());
            assertEquals(NotificationType.OPPORTUNITY_EXPIRING, plan.get(0).notification().type());
            assertEquals(List.of("expiring:soon"), plan.get(0).deliveryKeys());
        }

        @Test
        @DisplayName("already delivered keys are not planned again")
        void alreadySent() {
            List<PlannedNotification> plan = policy.plan(List.of(urgent(), high()), List.of(), settings,
                    Set.of("alert:u", "alert:h")::contains, WINDOW, NOW);

            assertTrue(plan.isEmpty());
        }

        @Test
        @DisplayName("open items close to expiry are bundled as a reminder")
        void expiringSoon() {
            OpportunitySuggestion soon = suggestion("soon").expiresAt(NOW.plus(Duration.ofDays(2))).build();
            OpportunitySuggestion later = suggestion("later").expiresAt(NOW.plus(Duration.ofDays(10))).build();

            List<PlannedNotification> plan = policy.plan(List.of(), List.of(later, soon), settings,
                    NOTHING_SENT, WINDOW, NOW);

            assertEquals(1, plan.size());
            assertEquals(NotificationType.OPPORTUNITY_EXPIRING, plan.get(0).notification().type());
            assertEquals(List.of("expiring:soon"), plan.get(0).deliveryKeys());
        }
    }

    @Nested
    @DisplayName("digest()")
    class Digest {

        @Test
        @DisplayName("top items by composite score under today's key")
        void topItems() {
            List<PlannedNotification> plan = policy.digest(List.of(low(), urgent(), high(), medium()), settings,
                    NOTHING_SENT, 2, NOW);

            assertEquals(1, plan.size());
            assertEquals(List.of("u", "h"), plan.get(0).notification().opportunityIds());
            assertEquals(List.of(DeliveryKeys.digest(LocalDate.of(2024, 6, 15))), plan.get(0).deliveryKeys());
            assertEquals(NotificationType.DAILY_DIGEST, plan.get(0).notification().type());
        }

        @Test
        @DisplayName("one digest per day, and none when disabled or empty")
        void guards() {
            assertTrue(policy.digest(List.of(high()), settings, "digest:2024-06-15"::equals, 5, NOW).isEmpty());
            assertTrue(policy.digest(List.of(high()), settings.toBuilder().dailyDigest(false).build(),
                    NOTHING_SENT, 5, NOW).isEmpty());
            assertTrue(policy.digest(List.of(), settings, NOTHING_SENT, 5, NOW).isEmpty());
        }
    }
}

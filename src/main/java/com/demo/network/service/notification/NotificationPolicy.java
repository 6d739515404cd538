package com.demo.network.service.notification;

import com.demo.network.model.Notification;
import com.demo.network.model.NotificationSettings;
import com.demo.network.model.NotificationType;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunitySuggestion;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides what one user should be told. Pure: the caller supplies the suggestions, the settings
 * and a predicate telling which delivery keys were already used.
 */
@Component
public class NotificationPolicy {

    /**
     * Partitions new suggestions into one alert per URGENT item, one bundle for HIGH and MEDIUM
     * items, and one bundle for open items expiring within {@code expiringWindow}. Dismissed,
     * closed, expired and already-notified suggestions are left out. Turning real-time alerts
     * off silences the first two only; expiry reminders are still planned.
     */
    public List<PlannedNotification> plan(List<OpportunitySuggestion> newSuggestions,
                                          List<OpportunitySuggestion> openSuggestions,
                                          NotificationSettings settings,
                                          Predicate<String> alreadySent,
                                          Duration expiringWindow,
                                          Instant now) {
        List<PlannedNotification> out = new ArrayList<>();
        if (settings.realTimeAlerts()) {
            out.addAll(alerts(newSuggestions, settings, alreadySent, now));
        }

        Instant horizon = now.plus(expiringWindow);
        List<OpportunitySuggestion> expiring = openSuggestions.stream()
                .filter(s -> deliverable(s, settings, now))
                .filter(s -> s.expiresAt() != null && !s.expiresAt().isAfter(horizon))
                .filter(s -> !alreadySent.test(DeliveryKeys.expiring(s.id())))
                .sorted(Comparator.comparing(OpportunitySuggestion::expiresAt))
                .toList();
        if (!expiring.isEmpty()) {
            out.add(bundle(NotificationType.OPPORTUNITY_EXPIRING,
                    "Opportunities Expiring Soon",
                    expiring.size() + " opportunities expire within " + expiringWindow.toDays() + " days",
                    OpportunityPriority.HIGH, expiring, settings, now, DeliveryKeys::expiring));
        }
        return out;
    }

    private List<PlannedNotification> alerts(List<OpportunitySuggestion> newSuggestions,
                                             NotificationSettings settings,
                                             Predicate<String> alreadySent,
                                             Instant now) {
        List<OpportunitySuggestion> fresh = newSuggestions.stream()
                .filter(s -> deliverable(s, settings, now))
                .filter(s -> s.confidenceScore() >= settings.minConfidence() && s.impactScore() >= settings.minImpact())
                .filter(s -> !settings.urgentOnly() || s.priority() == OpportunityPriority.URGENT)
                .filter(s -> !alreadySent.test(DeliveryKeys.alert(s.id())))
                .sorted(Comparator.comparingDouble(OpportunitySuggestion::compositeScore).reversed())
                .toList();

        List<PlannedNotification> out = new ArrayList<>();
        for (OpportunitySuggestion s : fresh) {
            if (s.priority() != OpportunityPriority.URGENT) continue;
            out.add(new PlannedNotification(Notification.builder()
                    .id(UUID.randomUUID().toString())
                    .type(NotificationType.URGENT_OPPORTUNITY)
                    .title("Urgent Opportunity Detected!")
                    .message(String.format("High-impact opportunity: %s. Confidence: %d%%",
                            s.title(), Math.round(s.confidenceScore() * 100)))
                    .priority(OpportunityPriority.URGENT)
                    .opportunityIds(List.of(s.id()))
                    .userId(settings.userId())
                    .accountId(settings.accountId())
                    .createdAt(now)
                    .metadata(Map.of("category", s.category().name(), "impactScore", s.impactScore()))
                    .build(), List.of(DeliveryKeys.alert(s.id()))));
        }

        List<OpportunitySuggestion> bundled = fresh.stream()
                .filter(s -> s.priority() == OpportunityPriority.HIGH || s.priority() == OpportunityPriority.MEDIUM)
                .toList();
        if (!bundled.isEmpty()) {
            boolean anyHigh = bundled.stream().anyMatch(s -> s.priority() == OpportunityPriority.HIGH);
            out.add(bundle(NotificationType.NEW_OPPORTUNITY,
                    bundled.size() + (anyHigh ? " New High-Priority Opportunities" : " New Opportunities"),
                    "New opportunities detected: " + titles(bundled),
                    anyHigh ? OpportunityPriority.HIGH : OpportunityPriority.MEDIUM,
                    bundled, settings, now, DeliveryKeys::alert));
        }
        return out;
    }

    /** Top {@code size} open suggestions by composite score, or empty when the digest is off or already sent today. */
    public List<PlannedNotification> digest(List<OpportunitySuggestion> openSuggestions,
                                            NotificationSettings settings,
                                            Predicate<String> alreadySent,
                                            int size,
                                            Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        String key = DeliveryKeys.digest(today);
        if (!settings.dailyDigest() || alreadySent.test(key)) {
            return List.of();
        }
        List<OpportunitySuggestion> top = openSuggestions.stream()
                .filter(s -> deliverable(s, settings, now))
                .sorted(Comparator.comparingDouble(OpportunitySuggestion::compositeScore).reversed()
                        .thenComparing(OpportunitySuggestion::id))
                .limit(Math.max(0, size))
                .toList();
        if (top.isEmpty()) {
            return List.of();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("date", today.toString());
        metadata.put("count", top.size());
        return List.of(new PlannedNotification(Notification.builder()
                .id(UUID.randomUUID().toString())
                .type(NotificationType.DAILY_DIGEST)
                .title("Your Daily Opportunity Digest")
                .message(top.size() + " opportunities ready for your review")
                .priority(OpportunityPriority.MEDIUM)
                .opportunityIds(top.stream().map(OpportunitySuggestion::id).toList())
                .userId(settings.userId())
                .accountId(settings.accountId())
                .createdAt(now)
                .metadata(metadata)
                .build(), List.of(key)));
    }

    private static boolean deliverable(OpportunitySuggestion s, NotificationSettings settings, Instant now) {
        return s.status().isOpen() && !s.isExpiredAt(now) && settings.accepts(s.category());
    }

    private static PlannedNotification bundle(NotificationType type, String title, String message,
                                               OpportunityPriority priority, List<OpportunitySuggestion> items,
                                               NotificationSettings settings, Instant now,
                                               Function<String, String> keyOf) {
        List<String> ids = items.stream().map(OpportunitySuggestion::id).toList();
        return new PlannedNotification(Notification.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .title(title)
                .message(message)
                .priority(priority)
                .opportunityIds(ids)
                .userId(settings.userId())
                .accountId(settings.accountId())
                .createdAt(now)
                .metadata(Map.of("count", ids.size()))
                .build(), ids.stream().map(keyOf).toList());
    }

    private static String titles(List<OpportunitySuggestion> items) {
        String head = items.stream().limit(2).map(OpportunitySuggestion::title).collect(Collectors.joining(", "));
        return items.size() > 2 ? head + " and " + (items.size() - 2) + " more" : head;
    }
}

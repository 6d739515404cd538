package com.demo.network.service.tracking;

import com.demo.network.exception.ConflictException;
import com.demo.network.exception.NotFoundException;
import com.demo.network.exception.ValidationException;
import com.demo.network.model.ActualOutcome;
import com.demo.network.model.LearningSignal;
import com.demo.network.model.OpportunityFeedback;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OutcomeMetadata;
import com.demo.network.repository.FeedbackRepository;
import com.demo.network.repository.OpportunityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/** Records what happened after an opportunity was acted on and aggregates it into metrics. */
@Slf4j
@Service
public class SuccessTrackingService {

    static final double SUCCESS_IMPACT_RATIO = 0.8;
    static final double HIGH_CONFIDENCE = 0.7;
    static final double QUICK_ACTION_DAYS = 3;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final OpportunityRepository opportunityRepository;
    private final FeedbackRepository feedbackRepository;
    private final Clock clock;

    public SuccessTrackingService(OpportunityRepository opportunityRepository,
                                  FeedbackRepository feedbackRepository,
                                  Clock clock) {
        this.opportunityRepository = opportunityRepository;
        this.feedbackRepository = feedbackRepository;
        this.clock = clock;
    }

    /**
     * Stores the feedback, closes the opportunity if it is still open and returns the learning
     * signal. The close is an optimistic status write, so two racing submissions cannot both win.
     *
     * @throws ValidationException for a rating outside 1-5, impact outside 0-100 or negative time
     * @throws NotFoundException   when the opportunity does not exist
     * @throws ConflictException   when feedback was already recorded or the status changed underneath
     */
    @Transactional
    public LearningSignal recordFeedback(FeedbackCommand cmd) {
        validate(cmd);
        OpportunitySuggestion opp = opportunityRepository.findById(cmd.opportunityId())
                .orElseThrow(() -> NotFoundException.of("Opportunity", cmd.opportunityId()));
        if (feedbackRepository.findByOpportunity(opp.id()).isPresent()) {
            throw new ConflictException("Feedback already recorded for opportunity " + opp.id());
        }

        Instant now = clock.instant();
        if (!opp.status().isTerminal()) {
            Instant actedAt = opp.status().isOpen() ? now : null;
            if (!opportunityRepository.updateStatus(opp.id(), opp.status(), OpportunityStatus.COMPLETED, actedAt, now)) {
                throw new ConflictException("Opportunity " + opp.id() + " was closed concurrently");
            }
        }

        boolean success = isSuccess(cmd.rating(), cmd.actualOutcome(), cmd.actualImpact(), opp.impactScore());
        feedbackRepository.insert(OpportunityFeedback.builder()
                .opportunityId(opp.id())
                .userId(cmd.userId())
                .rating(cmd.rating())
                .actualOutcome(cmd.actualOutcome())
                .actualImpact(cmd.actualImpact())
                .timeInvestedHours(cmd.timeInvestedHours())
                .freeText(cmd.freeText())
                .success(success)
                .createdAt(now)
                .build());
        opportunityRepository.recordOutcome(opp.id(),
                new OutcomeMetadata(cmd.actualOutcome(), cmd.rating(), cmd.actualImpact(), success));

        LearningSignal signal = new LearningSignal(opp.category(), opp.type(), opp.confidenceScore(),
                opp.impactScore(), cmd.actualOutcome(), cmd.actualImpact(), cmd.rating(), success);
        log.info("Learning signal for opportunity {}: category={} predicted=({}, {}) actual=({}, {}) success={}",
                opp.id(), signal.category(), signal.predictedConfidence(), signal.predictedImpact(),
                signal.actualOutcome(), signal.actualImpact(), success);
        return signal;
    }

    static boolean isSuccess(int rating, ActualOutcome outcome, double actualImpact, double predictedImpact) {
        return rating >= 4
                && outcome == ActualOutcome.SUCCESS
                && actualImpact >= SUCCESS_IMPACT_RATIO * predictedImpact;
    }

    private static void validate(FeedbackCommand cmd) {
        if (cmd.opportunityId() == null || cmd.opportunityId().isBlank()) {
            throw new ValidationException("opportunityId is required");
        }
        if (cmd.rating() < 1 || cmd.rating() > 5) {
            throw new ValidationException("rating must be between 1 and 5 but was " + cmd.rating());
        }
        if (cmd.actualOutcome() == null) {
            throw new ValidationException("actualOutcome is required");
        }
        ValidationException.requirePercent("actualImpact", cmd.actualImpact());
        if (Double.isNaN(cmd.timeInvestedHours()) || cmd.timeInvestedHours() < 0) {
            throw new ValidationException("timeInvestedHours must not be negative");
        }
    }

    public SuccessMetrics computeMetrics(String accountId, int windowDays) {
        if (windowDays <= 0) {
            throw new ValidationException("windowDays must be positive");
        }
        Instant now = clock.instant();
        List<OpportunitySuggestion> all = opportunityRepository.listCreatedSince(accountId, now.minus(Duration.ofDays(windowDays)));
        List<OpportunitySuggestion> considered = all.stream()
                .filter(s -> s.status() != OpportunityStatus.EXPIRED)
                .toList();

        int n = considered.size();
        long viewed = considered.stream().filter(s -> OpportunityStatus.VIEWED_OR_LATER.contains(s.status())).count();
        long accepted = considered.stream().filter(s -> OpportunityStatus.ACCEPTED_OR_LATER.contains(s.status())).count();
        long completed = considered.stream().filter(s -> s.status() == OpportunityStatus.COMPLETED).count();

        List<Double> toAction = new ArrayList<>();
        List<Double> toCompletion = new ArrayList<>();
        int quick = 0;
        for (OpportunitySuggestion s : considered) {
            if (s.actedAt() != null) {
                double d = days(s.createdAt(), s.actedAt());
                toAction.add(d);
                if (d <= QUICK_ACTION_DAYS) quick++;
            }
            if (s.completedAt() != null) {
                toCompletion.add(days(s.createdAt(), s.completedAt()));
            }
        }

        List<OpportunitySuggestion> closed = considered.stream()
                .filter(s -> s.status() == OpportunityStatus.COMPLETED && s.outcome() != null)
                .toList();

        double engagement = n == 0 ? 0 : (
                0.2 * viewed / n
                        + 0.3 * accepted / n
                        + 0.3 * toAction.size() / n
                        + 0.2 * quick / n) * 100;

        return new SuccessMetrics(
                accountId,
                windowDays,
                all.size(),
                n,
                percent(accepted, n),
                percent(completed, accepted),
                percent(viewed, n),
                round2(mean(toAction)),
                round2(median(toAction)),
                round2(mean(toCompletion)),
                round2(median(toCompletion)),
                successRateBy(considered, s -> s.category().name()),
                successRateBy(considered, s -> s.type().name()),
                successRateBy(considered, s -> s.priority().name()),
                closed.size(),
                confidenceAccuracy(closed),
                impactAccuracy(closed),
                round2(engagement),
                toAction.size(),
                (int) accepted,
                now);
    }

    /** Share of closed suggestions where "confidence above 0.7" agreed with the recorded success. */
    static double confidenceAccuracy(List<OpportunitySuggestion> closed) {
        if (closed.isEmpty()) return 0;
        int agree = 0;
        for (OpportunitySuggestion s : closed) {
            if ((s.confidenceScore() > HIGH_CONFIDENCE) == s.outcome().success()) agree++;
        }
        return round2((double) agree / closed.size());
    }

    /** 1 - mean relative impact error, floored at 0. Suggestions predicted at zero impact are skipped. */
    static double impactAccuracy(List<OpportunitySuggestion> closed) {
        double totalError = 0;
        int counted = 0;
        for (OpportunitySuggestion s : closed) {
            if (s.impactScore() <= 0) continue;
            totalError += Math.abs(s.impactScore() - s.outcome().actualImpact()) / s.impactScore();
            counted++;
        }
        if (counted == 0) return 0;
        return round2(Math.max(0, 1 - totalError / counted));
    }

    private static Map<String, Double> successRateBy(List<OpportunitySuggestion> items,
                                                     Function<OpportunitySuggestion, String> key) {
        Map<String, int[]> groups = new TreeMap<>();
        for (OpportunitySuggestion s : items) {
            int[] g = groups.computeIfAbsent(key.apply(s), k -> new int[2]);
            g[0]++;
            if (s.outcome() != null && s.outcome().success()) g[1]++;
        }
        Map<String, Double> out = new TreeMap<>();
        groups.forEach((k, g) -> out.put(k, percent(g[1], g[0])));
        return out;
    }

    private static double days(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds() / SECONDS_PER_DAY;
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) return 0;
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double percent(long part, long whole) {
        return whole == 0 ? 0 : round2(100.0 * part / whole);
    }

    private static double round2(double v) {
        return Math.round(v * 100) / 100.0;
    }
}

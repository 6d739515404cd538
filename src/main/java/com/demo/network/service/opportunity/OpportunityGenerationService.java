package com.demo.network.service.opportunity;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.repository.ContactFilter;
import com.demo.network.repository.ContactRepository;
import com.demo.network.repository.OpportunityRepository;
import com.demo.network.repository.RelationshipRepository;
import com.demo.network.service.batch.BatchResult;
import com.demo.network.service.batch.ChunkedBatchRunner;
import com.demo.network.service.narrative.NarrativeGenerator;
import com.demo.network.service.opportunity.patterns.OpportunityDraft;
import com.demo.network.service.opportunity.patterns.OpportunityPattern;
import com.demo.network.service.opportunity.patterns.PatternContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs every registered pattern over an account snapshot, attaches impact, priority and expiry,
 * drops duplicates of still-open suggestions and stores the best ones.
 */
@Slf4j
@Service
public class OpportunityGenerationService {

    public static final String JOB = "opportunity-generation";

    private final ContactRepository contactRepository;
    private final RelationshipRepository relationshipRepository;
    private final OpportunityRepository opportunityRepository;
    private final List<OpportunityPattern> patterns;
    private final NarrativeGenerator narrativeGenerator;
    private final ChunkedBatchRunner batchRunner;
    private final NetworkProperties.Opportunity settings;
    private final int chunkSize;
    private final Clock clock;

    public OpportunityGenerationService(ContactRepository contactRepository,
                                        RelationshipRepository relationshipRepository,
                                        OpportunityRepository opportunityRepository,
                                        List<OpportunityPattern> patterns,
                                        NarrativeGenerator narrativeGenerator,
                                        ChunkedBatchRunner batchRunner,
                                        NetworkProperties properties,
                                        Clock clock) {
        this.contactRepository = contactRepository;
        this.relationshipRepository = relationshipRepository;
        this.opportunityRepository = opportunityRepository;
        this.patterns = List.copyOf(patterns);
        this.narrativeGenerator = narrativeGenerator;
        this.batchRunner = batchRunner;
        this.settings = properties.getOpportunity();
        this.chunkSize = properties.getBatch().getChunkSize();
        this.clock = clock;
    }

    /** Ranked suggestions the next run would consider. Nothing is stored and open duplicates are not checked. */
    public List<OpportunitySuggestion> preview(String accountId, OpportunityFilter filter) {
        return candidates(accountId, filter, clock.instant());
    }

    /**
     * Stores ranked suggestions that have no open duplicate. Narratives are fetched before
     * any chunk transaction opens; the duplicate check is repeated inside the chunk.
     */
    public BatchResult generate(String accountId, OpportunityFilter filter) {
        Instant now = clock.instant();
        List<OpportunitySuggestion> enriched = new ArrayList<>();
        for (OpportunitySuggestion s : candidates(accountId, filter, now)) {
            if (opportunityRepository.findOpenByDedupeKey(accountId, s.dedupeKey()).isPresent()) continue;
            enriched.add(enrich(s));
        }
        return batchRunner.run(JOB, accountId, enriched, chunkSize, OpportunitySuggestion::dedupeKey, (chunk, outcome) -> {
            for (OpportunitySuggestion s : chunk) {
                if (opportunityRepository.findOpenByDedupeKey(accountId, s.dedupeKey()).isPresent()) {
                    continue;
                }
                opportunityRepository.create(s.toBuilder().id(UUID.randomUUID().toString()).build());
                outcome.created(1);
            }
        });
    }

    List<OpportunitySuggestion> candidates(String accountId, OpportunityFilter filter, Instant now) {
        OpportunityFilter f = filter == null ? OpportunityFilter.none() : filter;
        PatternContext ctx = snapshot(accountId, now);

        Map<String, OpportunitySuggestion> byKey = new LinkedHashMap<>();
        for (OpportunityPattern pattern : patterns) {
            List<OpportunityDraft> drafts = pattern.detect(ctx);
            log.debug("Pattern {} found {} drafts for account {}", pattern.name(), drafts.size(), accountId);
            for (OpportunityDraft d : drafts) {
                OpportunitySuggestion s = toSuggestion(ctx, d);
                if (s.confidenceScore() < settings.getMinConfidence() || !f.matches(s)) continue;
                byKey.merge(s.dedupeKey(), s, (a, b) -> a.compositeScore() >= b.compositeScore() ? a : b);
            }
        }

        List<OpportunitySuggestion> out = new ArrayList<>(byKey.values());
        out.sort(Comparator.comparingDouble(OpportunitySuggestion::compositeScore).reversed()
                .thenComparing(OpportunitySuggestion::dedupeKey));
        int limit = f.limitOr(settings.getMaxPerRun());
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    OpportunitySuggestion toSuggestion(PatternContext ctx, OpportunityDraft d) {
        Instant now = ctx.asOf();
        Contact primary = ctx.contactsById().get(d.primaryContactId());
        double impact = d.impactOverride() != null
                ? d.impactOverride()
                : impact(primary == null ? 0 : primary.strategicValueOrZero(), d.pathStrength(), d.urgency());
        impact = Math.max(0, Math.min(100, impact));
        Integer expiryDays = settings.getExpiryDays().get(d.category());

        return OpportunitySuggestion.builder()
                .accountId(ctx.accountId())
                .category(d.category())
                .type(d.type())
                .title(d.title())
                .description(d.description())
                .confidenceScore(d.confidence())
                .impactScore(impact)
                .urgencyScore(d.urgency())
                .priority(PriorityBuckets.bucket(d.confidence(), impact))
                .status(OpportunityStatus.PENDING)
                .primaryContactId(d.primaryContactId())
                .secondaryContactId(d.secondaryContactId())
                .dedupeKey(d.category() + "|" + d.primaryContactId() + "|" + d.pathSignature())
                .evidenceFactors(d.evidenceFactors())
                .createdAt(now)
                .expiresAt(expiryDays == null ? null : now.plus(Duration.ofDays(expiryDays)))
                .build();
    }

    /** Impact from the target's strategic value, the strength of the path to it and how urgent it is. */
    static double impact(double strategicValue, double pathStrength, double urgency) {
        double raw = 0.6 * strategicValue + 25 * pathStrength + 0.15 * urgency;
        return Math.round(Math.max(0, Math.min(100, raw)) * 10) / 10.0;
    }

    private OpportunitySuggestion enrich(OpportunitySuggestion s) {
        String prompt = s.title() + "\n" + s.description() + "\n" + String.join("\n", s.evidenceFactors());
        return narrativeGenerator.summarize(prompt)
                .map(text -> s.toBuilder().description(text).build())
                .orElse(s);
    }

    private PatternContext snapshot(String accountId, Instant now) {
        List<Contact> active = contactRepository.list(accountId, ContactFilter.active());
        Map<String, Contact> byId = new LinkedHashMap<>();
        for (Contact c : active) byId.put(c.id(), c);
        List<Contact> sorted = new ArrayList<>(active);
        sorted.sort(Comparator.comparing(Contact::id));
        RelationshipGraph graph = RelationshipGraph.of(relationshipRepository.listByAccount(accountId));
        return new PatternContext(accountId, sorted, byId, graph, now, settings);
    }
}

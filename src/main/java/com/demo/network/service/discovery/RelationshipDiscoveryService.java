package com.demo.network.service.discovery;

import com.demo.network.config.NetworkProperties;
import com.demo.network.exception.ConflictException;
import com.demo.network.exception.NotFoundException;
import com.demo.network.model.CandidateStatus;
import com.demo.network.model.Contact;
import com.demo.network.model.EvidenceSignal;
import com.demo.network.model.PotentialRelationship;
import com.demo.network.model.Relationship;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.model.RelationshipSource;
import com.demo.network.model.RelationshipType;
import com.demo.network.model.SignalType;
import com.demo.network.repository.CandidateRepository;
import com.demo.network.repository.ContactFilter;
import com.demo.network.repository.ContactRepository;
import com.demo.network.repository.RelationshipRepository;
import com.demo.network.service.batch.BatchResult;
import com.demo.network.service.batch.ChunkOutcome;
import com.demo.network.service.batch.ChunkedBatchRunner;
import com.demo.network.service.evidence.EvidenceExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns evidence into candidate relationships, persists them in batches and applies
 * the user's approve/reject decisions.
 */
@Slf4j
@Service
public class RelationshipDiscoveryService {

    public static final String JOB = "discovery";

    private static final Comparator<PotentialRelationship> BEST_FIRST =
            Comparator.comparingDouble(PotentialRelationship::confidence).reversed()
                    .thenComparing(PotentialRelationship::relatedContactId);

    private final ContactRepository contactRepository;
    private final RelationshipRepository relationshipRepository;
    private final CandidateRepository candidateRepository;
    private final EvidenceExtractor evidenceExtractor;
    private final ChunkedBatchRunner batchRunner;
    private final NetworkProperties.Discovery props;
    private final int chunkSize;
    private final Clock clock;

    public RelationshipDiscoveryService(ContactRepository contactRepository,
                                        RelationshipRepository relationshipRepository,
                                        CandidateRepository candidateRepository,
                                        EvidenceExtractor evidenceExtractor,
                                        ChunkedBatchRunner batchRunner,
                                        NetworkProperties properties,
                                        Clock clock) {
        this.contactRepository = contactRepository;
        this.relationshipRepository = relationshipRepository;
        this.candidateRepository = candidateRepository;
        this.evidenceExtractor = evidenceExtractor;
        this.batchRunner = batchRunner;
        this.props = properties.getDiscovery();
        this.chunkSize = properties.getBatch().getChunkSize();
        this.clock = clock;
    }

    /**
     * Candidate for one pair, or empty when the confidence is under the floor, the pair is
     * already connected, or the same evidence was rejected before. A pending candidate with
     * the same fingerprint is returned as stored (non-null id).
     */
    public Optional<PotentialRelationship> discoverPair(Contact a, Contact b, RelationshipGraph graph) {
        if (a.id().equals(b.id()) || graph.connected(a.id(), b.id())) {
            return Optional.empty();
        }
        List<EvidenceSignal> evidence = evidenceExtractor.evidence(a, b, graph);
        if (evidence.isEmpty()) {
            return Optional.empty();
        }
        double confidence = confidence(evidence);
        if (confidence < props.getConfidenceFloor()) {
            return Optional.empty();
        }

        String fingerprint = FingerprintUtil.fingerprint(a.id(), b.id(), evidence);
        Optional<PotentialRelationship> known = candidateRepository.findCandidate(fingerprint);
        if (known.isPresent()) {
            PotentialRelationship k = known.get();
            if (k.status() == CandidateStatus.APPROVED) return Optional.empty();
            if (k.status() == CandidateStatus.REJECTED && !rejectionExpired(k)) return Optional.empty();
            if (k.status() == CandidateStatus.PENDING) return known;
        }

        return Optional.of(PotentialRelationship.builder()
                .accountId(a.accountId())
                .contactId(a.id())
                .relatedContactId(b.id())
                .inferredType(inferType(evidence))
                .confidence(confidence)
                .evidence(evidence)
                .fingerprint(fingerprint)
                .status(CandidateStatus.PENDING)
                .createdAt(clock.instant())
                .build());
    }

    /** Ranked candidates for one contact. Nothing is persisted. */
    public List<PotentialRelationship> discoverForContact(String accountId, String contactId) {
        Contact contact = contactRepository.get(contactId)
                .filter(c -> accountId.equals(c.accountId()))
                .orElseThrow(() -> NotFoundException.of("Contact", contactId));
        List<Contact> others = contactRepository.list(accountId, ContactFilter.active());
        RelationshipGraph graph = RelationshipGraph.of(relationshipRepository.listByAccount(accountId));

        List<PotentialRelationship> out = new ArrayList<>();
        for (Contact other : others) {
            if (other.id().equals(contactId)) continue;
            discoverPair(contact, other, graph).ifPresent(out::add);
        }
        out.sort(Comparator.comparingDouble(PotentialRelationship::confidence).reversed());
        return out;
    }

    /**
     * Scans every unordered pair of active contacts when both the contact count and the pair
     * count fit their limits, otherwise only pairs sharing a blocking key, and stores the best
     * candidates per source contact. Hitting the pair ceiling ends the scan and the run
     * reports PARTIAL.
     */
    public BatchResult discoverBatch(String accountId) {
        List<Contact> contacts = new ArrayList<>(contactRepository.list(accountId, ContactFilter.active()));
        contacts.sort(Comparator.comparing(Contact::id));
        RelationshipGraph graph = RelationshipGraph.of(relationshipRepository.listByAccount(accountId));
        long n = contacts.size();
        long allPairs = n * (n - 1) / 2;
        PairPlan plan = n <= props.getMaxContactsForFullScan() && allPairs <= props.getMaxPairs()
                ? PairPlan.fullScan(contacts)
                : PairPlan.blocked(contacts, graph);
        long[] pairBudget = {props.getMaxPairs()};
        boolean[] ceilingHit = {false};

        return batchRunner.run(JOB, accountId, contacts, chunkSize, Contact::id, (chunk, outcome) -> {
            for (Contact source : chunk) {
                if (ceilingHit[0]) return;
                List<Contact> partners = plan.partnersOf(source);
                if (partners.size() > pairBudget[0]) {
                    partners = partners.subList(0, (int) pairBudget[0]);
                    ceilingHit[0] = true;
                    log.warn("Discovery for account {} stopped at {}: pair ceiling {} reached",
                            accountId, source.id(), props.getMaxPairs());
                    outcome.incomplete("Pair ceiling of " + props.getMaxPairs() + " reached at " + source.id());
                }
                pairBudget[0] -= partners.size();
                storeBest(source, partners, graph, outcome);
            }
        });
    }

    /**
     * Ranks pending and fresh candidates together so a rerun selects the rows it stored last
     * time. Only fresh candidates inside the top slots are written.
     */
    private void storeBest(Contact source, List<Contact> partners, RelationshipGraph graph, ChunkOutcome outcome) {
        List<PotentialRelationship> ranked = new ArrayList<>();
        for (Contact partner : partners) {
            discoverPair(source, partner, graph).ifPresent(ranked::add);
        }
        ranked.sort(BEST_FIRST);
        int limit = Math.min(ranked.size(), props.getMaxCandidatesPerContact());
        for (PotentialRelationship candidate : ranked.subList(0, limit)) {
            if (candidate.id() != null) continue;
            Optional<PotentialRelationship> pending =
                    candidateRepository.findPendingForPair(candidate.contactId(), candidate.relatedContactId());
            if (pending.isPresent()) {
                candidateRepository.refresh(candidate.toBuilder()
                        .id(pending.get().id())
                        .createdAt(pending.get().createdAt())
                        .build());
            } else {
                candidateRepository.create(candidate.toBuilder().id(UUID.randomUUID().toString()).build());
                outcome.created(1);
            }
        }
    }

    public List<PotentialRelationship> listPending(String accountId) {
        return candidateRepository.listPending(accountId);
    }

    /** Promotes a pending candidate to a verified edge. A mutual edge is one row with the mutual flag set. */
    @Transactional
    public Relationship approve(String candidateId, boolean mutual, String notes) {
        PotentialRelationship candidate = candidateRepository.findById(candidateId)
                .orElseThrow(() -> NotFoundException.of("Candidate", candidateId));
        if (!candidate.isPending()) {
            throw new ConflictException("Candidate " + candidateId + " is already " + candidate.status());
        }
        if (relationshipRepository.existsBetween(candidate.contactId(), candidate.relatedContactId())) {
            throw new ConflictException("Contacts " + candidate.contactId() + " and "
                    + candidate.relatedContactId() + " are already connected");
        }
        Instant now = clock.instant();
        if (!candidateRepository.updateStatus(candidateId, CandidateStatus.PENDING, CandidateStatus.APPROVED, now)) {
            throw new ConflictException("Candidate " + candidateId + " was reviewed concurrently");
        }
        Relationship edge = relationshipRepository.create(Relationship.builder()
                .id(UUID.randomUUID().toString())
                .accountId(candidate.accountId())
                .contactId(candidate.contactId())
                .relatedContactId(candidate.relatedContactId())
                .type(candidate.inferredType())
                .strength(candidate.confidence())
                .notes(notes)
                .verified(true)
                .mutual(mutual)
                .source(RelationshipSource.AUTO_DISCOVERY)
                .createdAt(now)
                .build());
        log.info("Approved candidate {} as {} edge {}", candidateId, edge.type(), edge.id());
        return edge;
    }

    @Transactional
    public PotentialRelationship reject(String candidateId) {
        PotentialRelationship candidate = candidateRepository.findById(candidateId)
                .orElseThrow(() -> NotFoundException.of("Candidate", candidateId));
        if (!candidate.isPending()) {
            throw new ConflictException("Candidate " + candidateId + " is already " + candidate.status());
        }
        Instant now = clock.instant();
        if (!candidateRepository.updateStatus(candidateId, CandidateStatus.PENDING, CandidateStatus.REJECTED, now)) {
            throw new ConflictException("Candidate " + candidateId + " was reviewed concurrently");
        }
        return candidate.toBuilder().status(CandidateStatus.REJECTED).reviewedAt(now).build();
    }

    double confidence(List<EvidenceSignal> evidence) {
        double sum = 0.0;
        for (EvidenceSignal s : evidence) {
            sum += weightOf(s.type()) * s.score();
        }
        double clipped = Math.max(0.0, Math.min(1.0, sum));
        return Math.round(clipped * 10_000) / 10_000.0;
    }

    /** Type implied by the signal with the largest weighted contribution; earlier signals win ties. */
    RelationshipType inferType(List<EvidenceSignal> evidence) {
        EvidenceSignal dominant = null;
        double best = -1.0;
        for (SignalType type : SignalType.values()) {
            for (EvidenceSignal s : evidence) {
                if (s.type() != type) continue;
                double contribution = weightOf(type) * s.score();
                if (contribution > best) {
                    best = contribution;
                    dominant = s;
                }
            }
        }
        return dominant == null ? RelationshipType.ACQUAINTANCE : dominant.type().impliedType();
    }

    private double weightOf(SignalType type) {
        return switch (type) {
            case SAME_COMPANY -> props.getCompanyWeight();
            case SAME_EMAIL_DOMAIN -> props.getDomainWeight();
            case SAME_LOCATION -> props.getLocationWeight();
            case ROLE_SIMILARITY -> props.getRoleWeight();
            case MUTUAL_CONNECTIONS -> props.getMutualWeight();
        };
    }

    private boolean rejectionExpired(PotentialRelationship rejected) {
        if (props.getRejectionExpiryDays() <= 0 || rejected.reviewedAt() == null) {
            return false;
        }
        Instant until = rejected.reviewedAt().plus(Duration.ofDays(props.getRejectionExpiryDays()));
        return !clock.instant().isBefore(until);
    }
}

package com.demo.network.service.scoring;

import com.demo.network.config.NetworkProperties;
import com.demo.network.exception.NotFoundException;
import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityFlag;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.repository.ContactFilter;
import com.demo.network.repository.ContactRepository;
import com.demo.network.repository.ContactScorePatch;
import com.demo.network.repository.RelationshipRepository;
import com.demo.network.service.batch.BatchResult;
import com.demo.network.service.batch.ChunkedBatchRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes priority, opportunity and strategic scores as fixed linear combinations of the
 * six factor sub-scores, and writes them back to the contact.
 */
@Slf4j
@Service
public class ContactScoringService {

    public static final String JOB = "scoring";
    static final double HIGH_OPPORTUNITY_THRESHOLD = 70;
    static final double STRATEGIC_THRESHOLD = 60;
    private static final double WEIGHT_TOLERANCE = 0.001;

    private final ContactRepository contactRepository;
    private final RelationshipRepository relationshipRepository;
    private final Map<FactorKind, ScoringFactor> factors;
    private final ChunkedBatchRunner batchRunner;
    private final NetworkProperties.Scoring props;
    private final int chunkSize;
    private final Clock clock;

    public ContactScoringService(ContactRepository contactRepository,
                                 RelationshipRepository relationshipRepository,
                                 List<ScoringFactor> factors,
                                 ChunkedBatchRunner batchRunner,
                                 NetworkProperties properties,
                                 Clock clock) {
        this.contactRepository = contactRepository;
        this.relationshipRepository = relationshipRepository;
        this.batchRunner = batchRunner;
        this.props = properties.getScoring();
        this.chunkSize = properties.getBatch().getChunkSize();
        this.clock = clock;
        this.factors = new EnumMap<>(FactorKind.class);
        for (ScoringFactor f : factors) {
            this.factors.put(f.kind(), f);
        }
        for (FactorKind kind : FactorKind.values()) {
            if (!this.factors.containsKey(kind)) {
                throw new IllegalStateException("No scoring factor registered for " + kind);
            }
        }
        validateWeights(props);
        log.info("Contact scoring uses weights version {}", props.getWeightsVersion());
    }

    static void validateWeights(NetworkProperties.Scoring scoring) {
        for (ScoreType type : ScoreType.values()) {
            double sum = scoring.weightsFor(type).sum();
            if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
                throw new IllegalStateException(String.format(
                        "Weights for %s in version %s sum to %.4f, expected 1.0",
                        type, scoring.getWeightsVersion(), sum));
            }
        }
    }

    /** Pure scoring of one snapshot; nothing is written. */
    public ContactScores score(ScoringContext context) {
        List<FactorScore> results = new ArrayList<>(FactorKind.values().length);
        Set<OpportunityFlag> flags = EnumSet.noneOf(OpportunityFlag.class);
        for (FactorKind kind : FactorKind.values()) {
            FactorScore fs = factors.get(kind).compute(context);
            results.add(fs);
            flags.addAll(fs.flags());
        }
        return new ContactScores(
                context.contact().id(),
                aggregate(results, ScoreType.PRIORITY),
                aggregate(results, ScoreType.OPPORTUNITY),
                aggregate(results, ScoreType.STRATEGIC),
                flags,
                results,
                props.getWeightsVersion(),
                context.asOf());
    }

    double aggregate(List<FactorScore> results, ScoreType type) {
        NetworkProperties.FactorWeights w = props.weightsFor(type);
        double total = 0;
        for (FactorScore fs : results) {
            total += fs.score() * w.weightOf(fs.kind());
        }
        return round1(Math.max(0, Math.min(100, total)));
    }

    /** Scores one contact against the current account graph and stores the result. */
    public ContactScores scoreContact(String accountId, String contactId) {
        Contact contact = loadContact(accountId, contactId);
        AccountSnapshot snapshot = snapshot(accountId);
        ContactScores scores = score(snapshot.contextFor(contact, clock.instant(), props.getUserGoals()));
        write(scores);
        return scores;
    }

    /** Scores without writing, for explanations. */
    public ContactScores preview(String accountId, String contactId) {
        Contact contact = loadContact(accountId, contactId);
        return score(snapshot(accountId).contextFor(contact, clock.instant(), props.getUserGoals()));
    }

    /** Rescores every ACTIVE contact of the account in chunks. Re-running on unchanged data writes identical values. */
    public BatchResult scoreBatch(String accountId) {
        List<Contact> contacts = new ArrayList<>(contactRepository.list(accountId, ContactFilter.active()));
        contacts.sort(Comparator.comparing(Contact::id));
        AccountSnapshot snapshot = snapshot(accountId);
        Instant asOf = clock.instant();
        return batchRunner.run(JOB, accountId, contacts, chunkSize, Contact::id, (chunk, outcome) -> {
            for (Contact c : chunk) {
                write(score(snapshot.contextFor(c, asOf, props.getUserGoals())));
            }
        });
    }

    public List<Contact> topPriority(String accountId, int limit) {
        return ranked(accountId, limit, Contact::priorityScore, 0);
    }

    public List<Contact> highOpportunity(String accountId, int limit) {
        return ranked(accountId, limit, Contact::opportunityScore, HIGH_OPPORTUNITY_THRESHOLD);
    }

    public List<Contact> strategicRecommendations(String accountId, int limit) {
        return ranked(accountId, limit, Contact::strategicValue, STRATEGIC_THRESHOLD);
    }

    private List<Contact> ranked(String accountId, int limit, Function<Contact, Double> field, double threshold) {
        Comparator<Contact> byScore = Comparator.comparingDouble(c -> field.apply(c));
        return contactRepository.list(accountId, ContactFilter.active()).stream()
                .filter(c -> field.apply(c) != null && field.apply(c) >= threshold)
                .sorted(byScore.reversed().thenComparing(Contact::id))
                .limit(Math.max(0, limit))
                .toList();
    }

    private void write(ContactScores s) {
        contactRepository.update(s.contactId(), new ContactScorePatch(
                s.priorityScore(), s.opportunityScore(), s.strategicValue(), s.flags(), s.scoredAt()));
    }

    private Contact loadContact(String accountId, String contactId) {
        return contactRepository.get(contactId)
                .filter(c -> accountId.equals(c.accountId()))
                .orElseThrow(() -> NotFoundException.of("Contact", contactId));
    }

    private AccountSnapshot snapshot(String accountId) {
        Map<String, Contact> byId = new LinkedHashMap<>();
        for (Contact c : contactRepository.list(accountId, ContactFilter.all())) {
            byId.put(c.id(), c);
        }
        return new AccountSnapshot(RelationshipGraph.of(relationshipRepository.listByAccount(accountId)), byId);
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }

    private record AccountSnapshot(RelationshipGraph graph, Map<String, Contact> contactsById) {

        ScoringContext contextFor(Contact contact, Instant asOf, List<String> goals) {
            return new ScoringContext(contact, graph, contactsById, asOf, goals);
        }
    }
}

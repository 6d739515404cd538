package com.demo.network.service.scoring;

import com.demo.network.model.ContactTier;
import com.demo.network.support.Fixtures;
import com.demo.network.support.InMemoryContactRepository;
import com.demo.network.support.InMemoryRelationshipRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demo.network.support.Fixtures.ACCOUNT;
import static com.demo.network.support.Fixtures.contact;
import static com.demo.network.support.Fixtures.daysAgo;
import static org.junit.jupiter.api.Assertions.*;

class ScoreExplainServiceTest {

    @Test
    void explanation_sumsToScore_andIsRanked() {
        InMemoryContactRepository contacts = new InMemoryContactRepository().add(contact("a")
                .company("Contoso Ventures")
                .position("VP Sales")
                .tier(ContactTier.TIER_1)
                .lastContactDate(daysAgo(120))
                .build());
        ContactScoringService scoring = new ContactScoringService(contacts, new InMemoryRelationshipRepository(),
                ScoringTestSupport.allFactors(), Fixtures.runner(), Fixtures.properties(), Fixtures.clock());
        ScoreExplainService explain = new ScoreExplainService(scoring, Fixtures.properties());

        ScoreExplainService.Explanation e = explain.explain(ACCOUNT, "a", ScoreType.OPPORTUNITY);

        assertEquals(6, e.factors().size());
        double sum = e.factors().stream().mapToDouble(ScoreExplainService.Contribution::contribution).sum();
        assertEquals(e.score(), sum, 0.1);
        List<Double> contributions = e.factors().stream().map(ScoreExplainService.Contribution::contribution).toList();
        for (int i = 1; i < contributions.size(); i++) {
            assertTrue(contributions.get(i - 1) >= contributions.get(i));
        }
        assertEquals(0.35, e.factors().stream()
                .filter(c -> c.factor() == FactorKind.OPPORTUNITY_INDICATORS)
                .findFirst().orElseThrow().weight());
    }
}

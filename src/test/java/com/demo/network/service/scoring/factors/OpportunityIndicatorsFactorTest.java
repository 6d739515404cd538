package com.demo.network.service.scoring.factors;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityFlag;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.demo.network.support.Fixtures.NOW;
import static com.demo.network.support.Fixtures.contact;
import static com.demo.network.support.Fixtures.daysAgo;
import static com.demo.network.support.Fixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

class OpportunityIndicatorsFactorTest {

    private final OpportunityIndicatorsFactor factor = new OpportunityIndicatorsFactor();

    @Test
    @DisplayName("every rule contributes and raises its flag")
    void allRules() {
        Contact c = contact("a")
                .position("CEO")
                .company("Acme AI Startup")
                .updatedAt(daysAgo(10))
                .lastContactDate(daysAgo(120))
                .build();
        RelationshipGraph graph = RelationshipGraph.of(List.of(edge("a", "b", 0.7)));

        FactorScore s = factor.compute(new ScoringContext(c, graph, Map.of(), NOW, List.of()));

        // 25 recent + 24 trend + 15 growth + 10 reconnect + 10 decision maker + 10 warm intro
        assertEquals(94, s.score());
        assertEquals(EnumSet.of(OpportunityFlag.RECENT_JOB_CHANGE, OpportunityFlag.COMPANY_GROWTH,
                OpportunityFlag.RECONNECTION_OPPORTUNITY, OpportunityFlag.DECISION_MAKER,
                OpportunityFlag.WARM_INTRO_AVAILABLE), s.flags());
    }

    @Test
    @DisplayName("a bare contact only gets the neutral trend share")
    void bareContact() {
        FactorScore s = factor.compute(new ScoringContext(contact("a").build(), RelationshipGraph.empty(),
                Map.of(), NOW, List.of()));

        assertEquals(15, s.score());
        assertTrue(s.flags().isEmpty());
        assertEquals("Opportunity flags: none", s.reasoning());
    }
}

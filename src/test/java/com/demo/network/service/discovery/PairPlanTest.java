package com.demo.network.service.discovery;

import com.demo.network.model.Contact;
import com.demo.network.model.RelationshipGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demo.network.support.Fixtures.contact;
import static com.demo.network.support.Fixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

class PairPlanTest {

    @Test
    @DisplayName("full scan visits each unordered pair once")
    void fullScan_eachPairOnce() {
        List<Contact> sorted = List.of(contact("a").build(), contact("b").build(), contact("c").build());
        PairPlan plan = PairPlan.fullScan(sorted);

        int pairs = 0;
        for (Contact c : sorted) pairs += plan.partnersOf(c).size();

        assertEquals(3, pairs);
        assertTrue(plan.partnersOf(sorted.get(2)).isEmpty());
    }

    @Test
    @DisplayName("blocked plan pairs shared domains and two-hop neighbors")
    void blocked_keysAndNeighbors() {
        Contact a = contact("a").email("a@initech.io").build();
        Contact b = contact("b").email("b@initech.io").build();
        Contact c = contact("c").build();
        Contact d = contact("d").build();
        RelationshipGraph graph = RelationshipGraph.of(List.of(edge("a", "hub", 0.5), edge("hub", "d", 0.5)));

        PairPlan plan = PairPlan.blocked(List.of(a, b, c, d), graph);

        assertEquals(List.of("b", "d"), plan.partnersOf(a).stream().map(Contact::id).toList());
        assertTrue(plan.partnersOf(c).isEmpty());
    }
}

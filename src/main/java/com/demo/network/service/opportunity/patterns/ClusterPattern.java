package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import com.demo.network.service.evidence.ContactText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Several strategically valuable contacts at the same company and industry: an account to expand. */
@Component
public class ClusterPattern implements OpportunityPattern {

    static final double URGENCY = 50;

    @Override
    public String name() {
        return "cluster";
    }

    @Override
    public List<OpportunityDraft> detect(PatternContext ctx) {
        Map<String, List<Contact>> clusters = new TreeMap<>();
        for (Contact c : ctx.activeContacts()) {
            String company = ContactText.normalizeCompany(c.company());
            String industry = ContactText.normalize(c.industry());
            if (company == null || industry == null) continue;
            clusters.computeIfAbsent(company + "|" + industry, k -> new ArrayList<>()).add(c);
        }

        List<OpportunityDraft> out = new ArrayList<>();
        for (Map.Entry<String, List<Contact>> e : clusters.entrySet()) {
            List<Contact> members = e.getValue();
            int size = members.size();
            if (size < ctx.settings().getClusterMinSize()) continue;
            double meanStrategic = members.stream().mapToDouble(Contact::strategicValueOrZero).average().orElse(0);
            if (meanStrategic < ctx.settings().getClusterMinStrategicValue()) continue;

            Contact anchor = members.stream()
                    .sorted(Comparator.comparingDouble(Contact::strategicValueOrZero).reversed()
                            .thenComparing(Contact::id))
                    .findFirst()
                    .orElseThrow();
            double impact = Math.min(100, meanStrategic * Math.min(1.0, 0.6 + 0.1 * size));
            double confidence = Math.min(0.9, 0.4 + 0.1 * (size - 2));
            String company = anchor.company();

            out.add(OpportunityDraft.builder()
                    .category(OpportunityCategory.STRATEGIC_MOVE)
                    .type(OpportunityType.ACCOUNT_EXPANSION)
                    .title("Account expansion at " + company)
                    .description(String.format("You know %d people at %s in %s. Start with %s.",
                            size, company, anchor.industry(), anchor.displayName()))
                    .confidence(Math.round(confidence * 100) / 100.0)
                    .urgency(URGENCY)
                    .impactOverride(Math.round(impact * 10) / 10.0)
                    .primaryContactId(anchor.id())
                    .pathSignature("cluster:" + e.getKey())
                    .evidenceFactors(List.of(
                            size + " contacts share company and industry",
                            String.format("Mean strategic value %.1f", meanStrategic)))
                    .build());
        }
        return out;
    }
}

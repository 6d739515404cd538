package com.demo.network.service.scoring.factors;

import com.demo.network.model.Contact;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

import java.util.Set;

/** Size and quality of the contact's own neighborhood, i.e. how many warm paths run through it. */
@Component
public class MutualConnectionsFactor implements ScoringFactor {

    @Override
    public FactorKind kind() {
        return FactorKind.MUTUAL_CONNECTIONS;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        Set<String> neighbors = context.graph().neighbors(context.contact().id());
        int count = neighbors.size();
        int highValue = 0;
        for (String id : neighbors) {
            Contact n = context.contactsById().get(id);
            if (n != null && n.tier() != null && n.tier().isHighTier()) highValue++;
        }
        double quality = (double) highValue / Math.max(1, count) * 100;
        double score = Math.round(Math.min(100, Math.log10(count + 1) * 40 + quality * 0.6));
        int pathLength = count > 0 ? 1 : 3;

        return FactorScore.of(kind(), score, String.format(
                "%d mutual connections, %d high-value connections, intro path: %d step(s)",
                count, highValue, pathLength));
    }
}

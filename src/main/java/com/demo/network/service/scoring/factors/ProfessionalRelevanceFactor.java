package com.demo.network.service.scoring.factors;

import com.demo.network.model.Contact;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

@Component
public class ProfessionalRelevanceFactor implements ScoringFactor {

    @Override
    public FactorKind kind() {
        return FactorKind.PROFESSIONAL_RELEVANCE;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        Contact c = context.contact();
        // industry is matched together with the company name
        String companyText = c.industry() == null ? c.company()
                : c.company() == null ? c.industry() : c.company() + " " + c.industry();

        int alignment = ProfessionalSignals.industryAlignment(companyText, c.position(), context.userGoals());
        int seniority = ProfessionalSignals.seniority(c.position());
        int size = ProfessionalSignals.companySize(c.company());
        double score = Math.round(alignment * 0.4 + seniority * 0.35 + size * 0.25);

        return FactorScore.of(kind(), score, String.format(
                "Industry alignment: %d/100, Seniority: %d/100, Company scale: %d/100", alignment, seniority, size));
    }
}

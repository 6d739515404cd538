package com.demo.network.service.scoring;

import com.demo.network.config.NetworkProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class ScoreExplainService {

    private final ContactScoringService scoringService;
    private final NetworkProperties properties;

    public ScoreExplainService(ContactScoringService scoringService, NetworkProperties properties) {
        this.scoringService = scoringService;
        this.properties = properties;
    }

    public record Contribution(FactorKind factor, double score, double weight, double contribution, String reasoning) {
    }

    public record Explanation(String contactId, ScoreType scoreType, double score, String weightsVersion,
                              List<Contribution> factors) {
    }

    /** Factor sub-scores ordered by how much each contributes to the requested score. */
    public Explanation explain(String accountId, String contactId, ScoreType type) {
        ContactScores scores = scoringService.preview(accountId, contactId);
        NetworkProperties.FactorWeights weights = properties.getScoring().weightsFor(type);

        List<Contribution> out = new ArrayList<>();
        for (FactorScore fs : scores.factors()) {
            double w = weights.weightOf(fs.kind());
            out.add(new Contribution(fs.kind(), fs.score(), w, Math.round(fs.score() * w * 100) / 100.0, fs.reasoning()));
        }
        out.sort(Comparator.comparingDouble(Contribution::contribution).reversed()
                .thenComparing(Contribution::factor));
        return new Explanation(contactId, type, scores.scoreOf(type), scores.weightsVersion(), out);
    }
}

package com.demo.network.service.evidence;

import com.demo.network.model.Contact;
import com.demo.network.model.EvidenceSignal;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.model.SignalType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairwise similarity signals between two contacts. Pure and deterministic: the result
 * depends only on the two contact snapshots and the edge snapshot passed in.
 * Only signals with a positive score are returned, in {@link SignalType} order.
 */
@Component
public class EvidenceExtractor {

    static final double CITY_MATCH = 1.0;
    static final double STATE_MATCH = 0.6;
    static final double COUNTRY_MATCH = 0.3;
    static final double ROLE_MATCH = 0.5;
    static final int MUTUAL_SATURATION = 5;

    public List<EvidenceSignal> evidence(Contact a, Contact b, RelationshipGraph graph) {
        List<EvidenceSignal> out = new ArrayList<>(5);
        addIfPositive(out, sameCompany(a, b));
        addIfPositive(out, sameEmailDomain(a, b));
        addIfPositive(out, sameLocation(a, b));
        addIfPositive(out, roleSimilarity(a, b));
        addIfPositive(out, mutualConnections(a, b, graph));
        return out;
    }

    EvidenceSignal sameCompany(Contact a, Contact b) {
        String ca = ContactText.normalizeCompany(a.company());
        String cb = ContactText.normalizeCompany(b.company());
        if (ca != null && ca.equals(cb)) {
            return new EvidenceSignal(SignalType.SAME_COMPANY, 1.0, "Both work at " + a.company().trim());
        }
        return null;
    }

    EvidenceSignal sameEmailDomain(Contact a, Contact b) {
        String da = a.emailDomain();
        String db = b.emailDomain();
        if (da != null && da.equals(db) && !ContactText.isFreeEmailDomain(da)) {
            return new EvidenceSignal(SignalType.SAME_EMAIL_DOMAIN, 1.0, "Both use the " + da + " email domain");
        }
        return null;
    }

    EvidenceSignal sameLocation(Contact a, Contact b) {
        String cityA = ContactText.normalize(a.city());
        String stateA = ContactText.normalize(a.state());
        String countryA = ContactText.normalize(a.country());
        String cityB = ContactText.normalize(b.city());
        String stateB = ContactText.normalize(b.state());
        String countryB = ContactText.normalize(b.country());

        // a finer level only counts when the coarser levels do not contradict it
        boolean countryCompatible = countryA == null || countryB == null || countryA.equals(countryB);
        boolean stateCompatible = stateA == null || stateB == null || stateA.equals(stateB);

        if (cityA != null && cityA.equals(cityB) && stateCompatible && countryCompatible) {
            String where = a.city().trim() + (a.state() == null ? "" : ", " + a.state().trim());
            return new EvidenceSignal(SignalType.SAME_LOCATION, CITY_MATCH, "Both based in " + where);
        }
        if (stateA != null && stateA.equals(stateB) && countryCompatible) {
            return new EvidenceSignal(SignalType.SAME_LOCATION, STATE_MATCH, "Both based in " + a.state().trim());
        }
        if (countryA != null && countryA.equals(countryB)) {
            return new EvidenceSignal(SignalType.SAME_LOCATION, COUNTRY_MATCH, "Both based in " + a.country().trim());
        }
        return null;
    }

    EvidenceSignal roleSimilarity(Contact a, Contact b) {
        SeniorityLevel la = SeniorityLevel.of(a.position());
        SeniorityLevel lb = SeniorityLevel.of(b.position());
        if (la != null && Objects.equals(la, lb)) {
            return new EvidenceSignal(SignalType.ROLE_SIMILARITY, ROLE_MATCH, "Both hold " + la.label() + " roles");
        }
        return null;
    }

    EvidenceSignal mutualConnections(Contact a, Contact b, RelationshipGraph graph) {
        int mutual = graph == null ? 0 : graph.mutualCount(a.id(), b.id());
        if (mutual <= 0) return null;
        double score = Math.min(1.0, mutual / (double) MUTUAL_SATURATION);
        String detail = mutual == 1 ? "1 mutual connection" : mutual + " mutual connections";
        return new EvidenceSignal(SignalType.MUTUAL_CONNECTIONS, score, detail);
    }

    private static void addIfPositive(List<EvidenceSignal> out, EvidenceSignal s) {
        if (s != null && s.score() > 0.0) out.add(s);
    }
}

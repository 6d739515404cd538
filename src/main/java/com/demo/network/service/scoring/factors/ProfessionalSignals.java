package com.demo.network.service.scoring.factors;

import com.demo.network.service.evidence.ContactText;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Keyword heuristics over position and company text. Lookups are whole-word and case-insensitive. */
final class ProfessionalSignals {

    static final int DEFAULT_SENIORITY = 45;
    static final int DECISION_MAKER_SENIORITY = 85;

    // first match wins, so order matters
    private static final Map<String, Integer> SENIORITY = new LinkedHashMap<>();

    static {
        SENIORITY.put("ceo", 100);
        SENIORITY.put("vice president", 85);
        SENIORITY.put("president", 95);
        SENIORITY.put("founder", 95);
        SENIORITY.put("owner", 90);
        SENIORITY.put("cto", 95);
        SENIORITY.put("cfo", 95);
        SENIORITY.put("cmo", 95);
        SENIORITY.put("coo", 95);
        SENIORITY.put("vp", 85);
        SENIORITY.put("svp", 90);
        SENIORITY.put("director", 75);
        SENIORITY.put("head", 75);
        SENIORITY.put("chief", 80);
        SENIORITY.put("senior", 65);
        SENIORITY.put("lead", 60);
        SENIORITY.put("principal", 70);
        SENIORITY.put("manager", 55);
        SENIORITY.put("supervisor", 50);
        SENIORITY.put("associate", 40);
        SENIORITY.put("junior", 30);
        SENIORITY.put("intern", 20);
    }

    private static final List<String> RELEVANT_KEYWORDS = List.of(
            "technology", "software", "ai", "data", "digital", "startup", "venture",
            "marketing", "sales", "business development", "strategy", "consulting");
    private static final List<String> LARGE_COMPANIES = List.of(
            "microsoft", "google", "apple", "amazon", "facebook", "meta", "tesla");
    private static final List<String> INCORPORATED = List.of("inc", "corp", "corporation", "ltd", "llc");
    private static final List<String> TRENDING = List.of(
            "ai", "artificial intelligence", "machine learning", "blockchain", "crypto", "fintech");
    private static final List<String> EXPANSION_ROLES = List.of("manager", "director", "lead", "senior", "principal");
    private static final List<String> GROWTH = List.of("startup", "venture", "series", "funding", "ipo");

    private ProfessionalSignals() {
    }

    static int seniority(String position) {
        for (Map.Entry<String, Integer> e : SENIORITY.entrySet()) {
            if (ContactText.containsWord(position, e.getKey())) return e.getValue();
        }
        return DEFAULT_SENIORITY;
    }

    static int industryAlignment(String company, String position, List<String> goals) {
        String text = join(company, position);
        int matches = countMatches(text, RELEVANT_KEYWORDS);
        boolean goalHit = false;
        for (String goal : goals) {
            if (goal != null && !goal.isBlank() && ContactText.containsWord(text, goal.trim().toLowerCase(Locale.ROOT))) {
                goalHit = true;
                break;
            }
        }
        return Math.min(100, matches * 15 + (goalHit ? 20 : 0));
    }

    static int companySize(String company) {
        if (anyMatch(company, LARGE_COMPANIES)) return 90;
        if (anyMatch(company, INCORPORATED)) return 60;
        return 40;
    }

    static int industryTrend(String company) {
        return anyMatch(company, TRENDING) ? 80 : 50;
    }

    static boolean roleExpansion(String position) {
        return anyMatch(position, EXPANSION_ROLES);
    }

    static boolean companyGrowth(String company) {
        return anyMatch(company, GROWTH);
    }

    private static boolean anyMatch(String text, List<String> keywords) {
        return countMatches(text, keywords) > 0;
    }

    private static int countMatches(String text, List<String> keywords) {
        if (text == null) return 0;
        int n = 0;
        for (String k : keywords) {
            if (ContactText.containsWord(text, k)) n++;
        }
        return n;
    }

    private static String join(String a, String b) {
        return (a == null ? "" : a) + " " + (b == null ? "" : b);
    }
}

package com.demo.network.service.opportunity.patterns;

import com.demo.network.service.evidence.ContactText;

import java.util.List;

/** Rough company stage guessed from the company name. */
enum CompanyStage {
    ENTERPRISE,
    STARTUP,
    MEDIUM,
    SMALL;

    private static final List<String> ENTERPRISES = List.of(
            "microsoft", "google", "apple", "amazon", "facebook", "meta", "ibm");
    private static final List<String> EARLY_STAGE = List.of("startup", "stealth", "ventures", "labs");
    private static final List<String> INCORPORATED = List.of("inc", "corp", "corporation", "ltd", "llc");

    static CompanyStage of(String company) {
        if (company == null || company.isBlank()) return SMALL;
        if (anyWord(company, ENTERPRISES)) return ENTERPRISE;
        if (anyWord(company, EARLY_STAGE)) return STARTUP;
        if (anyWord(company, INCORPORATED)) return MEDIUM;
        return SMALL;
    }

    private static boolean anyWord(String text, List<String> words) {
        for (String w : words) {
            if (ContactText.containsWord(text, w)) return true;
        }
        return false;
    }
}

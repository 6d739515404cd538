package com.demo.network.service.evidence;

import java.util.List;

/** Coarse seniority bands recognised from position text. Checked top-down; the first match wins. */
public enum SeniorityLevel {
    C_LEVEL(List.of("ceo", "cto", "cfo", "cmo", "coo", "chief", "president", "founder", "owner")),
    VP(List.of("vp", "svp", "evp", "vice president")),
    DIRECTOR(List.of("director", "head")),
    MANAGER(List.of("manager", "lead", "principal", "supervisor")),
    SENIOR(List.of("senior", "sr"));

    private final List<String> keywords;

    SeniorityLevel(List<String> keywords) {
        this.keywords = keywords;
    }

    public static SeniorityLevel of(String position) {
        if (position == null || position.isBlank()) return null;
        // "vice president" must resolve to VP before "president" hits C_LEVEL
        if (ContactText.containsWord(position, "vice president")) return VP;
        for (SeniorityLevel level : values()) {
            for (String k : level.keywords) {
                if (ContactText.containsWord(position, k)) return level;
            }
        }
        return null;
    }

    public String label() {
        return switch (this) {
            case C_LEVEL -> "C-level";
            case VP -> "VP-level";
            case DIRECTOR -> "director-level";
            case MANAGER -> "manager-level";
            case SENIOR -> "senior";
        };
    }
}

package com.demo.network.service.evidence;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Normalization helpers shared by evidence extraction and discovery blocking. */
public final class ContactText {

    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "[\\s,]+(inc|incorporated|corp|corporation|co|company|llc|ltd|limited|gmbh|plc|sa|ag)\\.?$");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    private static final Set<String> FREE_EMAIL_DOMAINS = Set.of(
            "gmail.com", "googlemail.com", "yahoo.com", "hotmail.com", "outlook.com", "aol.com",
            "icloud.com", "me.com", "live.com", "msn.com", "proton.me", "protonmail.com",
            "comcast.net", "verizon.net", "gmx.com", "mail.com");

    private ContactText() {
    }

    /** "Acme, Inc." and "ACME inc" both become "acme"; blank input gives null. */
    public static String normalizeCompany(String company) {
        if (company == null) return null;
        String c = company.trim().toLowerCase(Locale.ROOT);
        String previous;
        do {
            previous = c;
            c = LEGAL_SUFFIX.matcher(c).replaceAll("").trim();
        } while (!c.equals(previous));
        c = NON_WORD.matcher(c).replaceAll(" ").trim();
        return c.isEmpty() ? null : c;
    }

    public static String normalize(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.isEmpty() ? null : v;
    }

    public static boolean isFreeEmailDomain(String domain) {
        return domain != null && FREE_EMAIL_DOMAINS.contains(domain.toLowerCase(Locale.ROOT));
    }

    public static Set<String> tokens(String text) {
        if (text == null) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(
                NON_WORD.split(text.toLowerCase(Locale.ROOT).trim())));
    }

    public static boolean containsWord(String text, String phrase) {
        if (text == null) return false;
        String padded = " " + NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim() + " ";
        return padded.contains(" " + phrase + " ");
    }
}

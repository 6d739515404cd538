package com.demo.network.service.discovery;

import com.demo.network.model.EvidenceSignal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;

/** Stable key for a candidate: sorted contact-id pair plus the evidence signature. */
public final class FingerprintUtil {

    private FingerprintUtil() {
    }

    public static String fingerprint(String contactId, String otherContactId, List<EvidenceSignal> evidence) {
        String first = contactId.compareTo(otherContactId) <= 0 ? contactId : otherContactId;
        String second = first.equals(contactId) ? otherContactId : contactId;
        return sha256(first + "|" + second + "|" + signature(evidence));
    }

    /** e.g. {@code SAME_COMPANY:1.00,SAME_EMAIL_DOMAIN:1.00} */
    public static String signature(List<EvidenceSignal> evidence) {
        StringBuilder sb = new StringBuilder();
        for (EvidenceSignal s : evidence) {
            if (sb.length() > 0) sb.append(',');
            sb.append(s.type().name()).append(':').append(String.format(Locale.ROOT, "%.2f", s.score()));
        }
        return sb.toString();
    }

    static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] b = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(b.length * 2);
            for (byte x : b) sb.append(String.format("%02x", x));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

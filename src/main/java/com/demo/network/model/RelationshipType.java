package com.demo.network.model;

/**
 * Kind of professional bond. {@code typeScore} feeds the relationship-strength factor (0-100),
 * {@code bondStrength} is the default edge strength used when estimating reconnection odds.
 */
public enum RelationshipType {
    CLIENT(90, 0.8),
    PARTNER(85, 0.8),
    COLLEAGUE(75, 0.7),
    MENTOR(95, 0.9),
    INVESTOR(90, 0.7),
    FRIEND(70, 0.9),
    ACQUAINTANCE(60, 0.4),
    PROSPECT(80, 0.3),
    VENDOR(65, 0.5),
    MENTEE(70, 0.8),
    COMPETITOR(40, 0.2),
    FAMILY(30, 0.5);

    public static final int UNKNOWN_TYPE_SCORE = 50;
    public static final double UNKNOWN_BOND_STRENGTH = 0.5;

    private final int typeScore;
    private final double bondStrength;

    RelationshipType(int typeScore, double bondStrength) {
        this.typeScore = typeScore;
        this.bondStrength = bondStrength;
    }

    public int typeScore() {
        return typeScore;
    }

    public double bondStrength() {
        return bondStrength;
    }

    public static int typeScoreOf(RelationshipType type) {
        return type == null ? UNKNOWN_TYPE_SCORE : type.typeScore;
    }

    public static double bondStrengthOf(RelationshipType type) {
        return type == null ? UNKNOWN_BOND_STRENGTH : type.bondStrength;
    }
}

package com.demo.network.model;

/** Outreach and campaign counters for one contact. */
public record EngagementStats(int outreachCount, int respondedCount, int campaignCount, int campaignResponded) {

    public static final EngagementStats EMPTY = new EngagementStats(0, 0, 0, 0);

    public double responseRate() {
        return outreachCount == 0 ? 0.0 : (double) respondedCount / outreachCount;
    }
}

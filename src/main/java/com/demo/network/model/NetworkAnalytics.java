package com.demo.network.model;

/** Graph metrics computed by the analytics layer; absent until that layer has run for a contact. */
public record NetworkAnalytics(double influenceScore, int totalConnections, double betweennessCentrality) {
}

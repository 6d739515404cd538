package com.demo.network.service.opportunity.patterns;

import java.util.List;

/** A pure detector over an account snapshot. New archetypes are added as new beans. */
public interface OpportunityPattern {

    String name();

    List<OpportunityDraft> detect(PatternContext context);
}

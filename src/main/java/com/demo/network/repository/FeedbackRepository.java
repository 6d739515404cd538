package com.demo.network.repository;

import com.demo.network.model.OpportunityFeedback;

import java.util.Optional;

public interface FeedbackRepository {

    /** @throws com.demo.network.exception.ConflictException when feedback for the opportunity exists */
    void insert(OpportunityFeedback feedback);

    Optional<OpportunityFeedback> findByOpportunity(String opportunityId);
}

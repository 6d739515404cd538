package com.demo.network.controller;

import com.demo.network.model.Contact;
import com.demo.network.service.scoring.ContactScores;
import com.demo.network.service.scoring.ContactScoringService;
import com.demo.network.service.scoring.ScoreExplainService;
import com.demo.network.service.scoring.ScoreType;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "scoring")
@RestController
@RequestMapping("/api/accounts/{accountId}/scores")
@RequiredArgsConstructor
@Validated
public class ScoringController {

    private final ContactScoringService scoringService;
    private final ScoreExplainService explainService;

    /** Scores one contact and persists the result. */
    @PostMapping("/contacts/{contactId}")
    public ContactScores score(@PathVariable String accountId, @PathVariable String contactId) {
        return scoringService.scoreContact(accountId, contactId);
    }

    /** Same computation without writing anything back. */
    @GetMapping("/contacts/{contactId}/preview")
    public ContactScores preview(@PathVariable String accountId, @PathVariable String contactId) {
        return scoringService.preview(accountId, contactId);
    }

    @GetMapping("/contacts/{contactId}/explain")
    public ScoreExplainService.Explanation explain(@PathVariable String accountId,
                                                   @PathVariable String contactId,
                                                   @RequestParam(defaultValue = "PRIORITY") ScoreType type) {
        return explainService.explain(accountId, contactId, type);
    }

    @GetMapping("/top-priority")
    public List<Contact> topPriority(@PathVariable String accountId,
                                     @RequestParam(defaultValue = "10") int limit) {
        return scoringService.topPriority(accountId, limit);
    }

    @GetMapping("/high-opportunity")
    public List<Contact> highOpportunity(@PathVariable String accountId,
                                         @RequestParam(defaultValue = "10") int limit) {
        return scoringService.highOpportunity(accountId, limit);
    }

    @GetMapping("/strategic")
    public List<Contact> strategic(@PathVariable String accountId,
                                   @RequestParam(defaultValue = "10") int limit) {
        return scoringService.strategicRecommendations(accountId, limit);
    }
}

package com.demo.network.controller;

import com.demo.network.controller.dto.ApproveRequest;
import com.demo.network.model.PotentialRelationship;
import com.demo.network.model.Relationship;
import com.demo.network.service.discovery.RelationshipDiscoveryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "discovery")
@RestController
@RequestMapping("/api/accounts/{accountId}/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

    private final RelationshipDiscoveryService discoveryService;

    // Synchronous scan for one contact against the rest of the account
    @PostMapping("/contacts/{contactId}")
    public Map<String, Object> discoverForContact(@PathVariable String accountId, @PathVariable String contactId) {
        List<PotentialRelationship> found = discoveryService.discoverForContact(accountId, contactId);
        return Map.of(
                "contactId", contactId,
                "count", found.size(),
                "candidates", found);
    }

    @GetMapping("/candidates")
    public List<PotentialRelationship> pending(@PathVariable String accountId) {
        return discoveryService.listPending(accountId);
    }

    @PostMapping("/candidates/{candidateId}/approve")
    public Relationship approve(@PathVariable String accountId,
                                @PathVariable String candidateId,
                                @RequestBody(required = false) ApproveRequest body) {
        ApproveRequest req = body != null ? body : new ApproveRequest();
        return discoveryService.approve(candidateId, req.mutual, req.notes);
    }

    @PostMapping("/candidates/{candidateId}/reject")
    public PotentialRelationship reject(@PathVariable String accountId, @PathVariable String candidateId) {
        return discoveryService.reject(candidateId);
    }
}

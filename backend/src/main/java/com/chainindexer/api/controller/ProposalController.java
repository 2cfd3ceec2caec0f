package com.chainindexer.api.controller;

import com.chainindexer.api.dto.DiscussionResponse;
import com.chainindexer.api.dto.PageResponse;
import com.chainindexer.api.dto.ProposalResponse;
import com.chainindexer.api.dto.ProposalVoteResponse;
import com.chainindexer.api.dto.RecommendationResponse;
import com.chainindexer.api.validation.HexAddress;
import com.chainindexer.query.ProposalQueryService;
import com.chainindexer.query.RecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Proposals with their discussions and votes, newest first.
 */
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
public class ProposalController {

    private final ProposalQueryService proposalQueryService;
    private final RecommendationService recommendationService;

    @GetMapping
    public ResponseEntity<PageResponse<ProposalResponse>> getProposals(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size,
            @RequestParam(required = false) String proposer
    ) {
        return ResponseEntity.ok(PageResponse.from(
                proposalQueryService.findProposals(page, size, proposer), ProposalResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProposalResponse> getProposal(@PathVariable long id) {
        return ResponseEntity.ok(ProposalResponse.from(proposalQueryService.getProposal(id)));
    }

    @GetMapping("/{id}/discussions")
    public ResponseEntity<PageResponse<DiscussionResponse>> getDiscussions(
            @PathVariable long id,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                proposalQueryService.findDiscussions(id, page, size), DiscussionResponse::from));
    }

    @GetMapping("/{id}/votes")
    public ResponseEntity<PageResponse<ProposalVoteResponse>> getVotes(
            @PathVariable long id,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                proposalQueryService.findVotes(id, page, size), ProposalVoteResponse::from));
    }

    /**
     * Asks the advisory agent how the given validator should vote. Blocking agent call.
     */
    @GetMapping("/{id}/recommendation")
    public ResponseEntity<RecommendationResponse> getRecommendation(
            @PathVariable long id,
            @RequestParam @HexAddress String voter
    ) {
        return ResponseEntity.ok(RecommendationResponse.from(recommendationService.recommendProposalVote(id, voter)));
    }
}

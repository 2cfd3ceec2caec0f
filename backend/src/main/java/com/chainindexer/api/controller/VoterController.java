package com.chainindexer.api.controller;

import com.chainindexer.api.dto.GrantVoteResponse;
import com.chainindexer.api.dto.PageResponse;
import com.chainindexer.api.dto.ProposalVoteResponse;
import com.chainindexer.api.validation.HexAddress;
import com.chainindexer.query.VoteQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Votes cast by one validator address.
 */
@RestController
@RequestMapping("/api/v1/voters/{address}")
@RequiredArgsConstructor
public class VoterController {

    private final VoteQueryService voteQueryService;

    @GetMapping("/proposal-votes")
    public ResponseEntity<PageResponse<ProposalVoteResponse>> getProposalVotes(
            @PathVariable @HexAddress String address,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                voteQueryService.findProposalVotesByVoter(address, page, size), ProposalVoteResponse::from));
    }

    @GetMapping("/grant-votes")
    public ResponseEntity<PageResponse<GrantVoteResponse>> getGrantVotes(
            @PathVariable @HexAddress String address,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                voteQueryService.findGrantVotesByVoter(address, page, size), GrantVoteResponse::from));
    }
}

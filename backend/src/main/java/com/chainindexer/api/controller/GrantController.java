package com.chainindexer.api.controller;

import com.chainindexer.api.dto.GrantResponse;
import com.chainindexer.api.dto.GrantVoteResponse;
import com.chainindexer.api.dto.PageResponse;
import com.chainindexer.api.dto.RecommendationResponse;
import com.chainindexer.query.GrantQueryService;
import com.chainindexer.query.RecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/grants")
@RequiredArgsConstructor
public class GrantController {

    private final GrantQueryService grantQueryService;
    private final RecommendationService recommendationService;

    @GetMapping
    public ResponseEntity<PageResponse<GrantResponse>> getGrants(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(grantQueryService.findGrants(page, size), GrantResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<GrantResponse> getGrant(@PathVariable long id) {
        return ResponseEntity.ok(GrantResponse.from(grantQueryService.getGrant(id)));
    }

    @GetMapping("/{id}/votes")
    public ResponseEntity<PageResponse<GrantVoteResponse>> getVotes(
            @PathVariable long id,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(grantQueryService.findVotes(id, page, size), GrantVoteResponse::from));
    }

    @GetMapping("/{id}/recommendation")
    public ResponseEntity<RecommendationResponse> getRecommendation(
            @PathVariable long id,
            @RequestParam(required = false, defaultValue = "") String statement
    ) {
        return ResponseEntity.ok(RecommendationResponse.from(recommendationService.recommendGrantVote(id, statement)));
    }
}

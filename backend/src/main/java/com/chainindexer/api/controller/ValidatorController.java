package com.chainindexer.api.controller;

import com.chainindexer.api.dto.ValidatorResponse;
import com.chainindexer.query.GrantQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/validators")
@RequiredArgsConstructor
public class ValidatorController {

    private final GrantQueryService grantQueryService;

    @GetMapping("/{index}")
    public ResponseEntity<ValidatorResponse> getValidator(@PathVariable long index) {
        return ResponseEntity.ok(ValidatorResponse.from(grantQueryService.getValidator(index)));
    }
}

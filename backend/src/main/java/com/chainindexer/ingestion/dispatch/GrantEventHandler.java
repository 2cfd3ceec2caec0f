package com.chainindexer.ingestion.dispatch;

import com.chainindexer.domain.Grant;
import com.chainindexer.domain.GrantRepository;
import com.chainindexer.domain.Validator;
import com.chainindexer.domain.ValidatorRepository;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import com.chainindexer.ingestion.decoder.ChainEventType;
import com.chainindexer.ingestion.decoder.GrantEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Upserts the validator and its latest grant decision, both keyed by validator index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GrantEventHandler implements ChainEventHandler {

    private final ChainEventDecoder decoder;
    private final ValidatorRepository validatorRepository;
    private final GrantRepository grantRepository;

    @Override
    public ChainEventType eventType() {
        return ChainEventType.GRANT;
    }

    @Override
    public void handle(ChainEvent event, long height) {
        decoder.decodeGrant(event).ifPresent(grant -> apply(grant, height));
    }

    private void apply(GrantEvent event, long height) {
        Validator validator = validatorRepository.findById(event.validator()).orElseGet(Validator::new);
        validator.setId(event.validator());
        validator.setAddress(event.address());
        validator.setAgentUrl(event.agentUrl());
        validator.setStake(event.amount());
        validatorRepository.save(validator);

        Grant grant = new Grant();
        grant.setId(event.validator());
        grant.setAddress(event.address());
        grant.setHeight(height);
        grant.setStake(event.amount());
        grant.setProposerIndex(event.proposerIndex());
        grant.setProposerAddress(event.proposerAddress());
        grant.setGrant(event.grant());
        grantRepository.save(grant);

        log.info("Grant for validator {} ({}) at height {}: grant={}, stake={}",
                event.validator(), event.address(), height, event.grant(), event.amount());
    }
}

package com.chainindexer.ingestion.dispatch;

import com.chainindexer.advisory.AdvisoryNotifier;
import com.chainindexer.domain.Proposal;
import com.chainindexer.domain.ProposalRepository;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import com.chainindexer.ingestion.decoder.ChainEventType;
import com.chainindexer.ingestion.decoder.ProposalEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores a new proposal created at the current height (unsettled) and asks the agent to read and comment on it.
 * A proposal already stored with this creation height is left as is when the height is replayed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProposalEventHandler implements ChainEventHandler {

    private final ChainEventDecoder decoder;
    private final ProposalRepository proposalRepository;
    private final AdvisoryNotifier advisoryNotifier;

    @Override
    public ChainEventType eventType() {
        return ChainEventType.PROPOSAL;
    }

    @Override
    public void handle(ChainEvent event, long height) {
        decoder.decodeProposal(event).ifPresent(proposal -> apply(proposal, height));
    }

    private void apply(ProposalEvent event, long height) {
        boolean replayed = proposalRepository.findById(event.proposal())
                .map(existing -> existing.getNewHeight() == height)
                .orElse(false);
        if (replayed) {
            log.debug("Proposal {} at height {} already stored", event.proposal(), height);
            return;
        }
        Proposal proposal = new Proposal();
        proposal.setId(event.proposal());
        proposal.setProposerIndex(event.proposer());
        proposal.setProposerAddress(event.proposerAddress());
        proposal.setData(event.data());
        proposal.setNewHeight(height);
        proposal.setSettleHeight(0L);
        proposal.setStatus(event.status());
        proposalRepository.save(proposal);
        log.info("Proposal {} by {} at height {}", event.proposal(), event.proposerAddress(), height);

        try {
            advisoryNotifier.proposalCreated(event.proposal(), event.proposerAddress(), event.data());
        } catch (RuntimeException e) {
            log.warn("Agent notification for proposal {} not queued: {}", event.proposal(), e.getMessage());
        }
    }
}

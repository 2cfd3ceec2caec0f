package com.chainindexer.ingestion.dispatch;

import com.chainindexer.domain.Proposal;
import com.chainindexer.domain.ProposalRepository;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import com.chainindexer.ingestion.decoder.ChainEventType;
import com.chainindexer.ingestion.decoder.SettleProposalEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Records a proposal's outcome and settlement height. The settlement height is written once; later settle events
 * for the same proposal are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettleProposalEventHandler implements ChainEventHandler {

    private final ChainEventDecoder decoder;
    private final ProposalRepository proposalRepository;

    @Override
    public ChainEventType eventType() {
        return ChainEventType.SETTLE_PROPOSAL;
    }

    @Override
    public void handle(ChainEvent event, long height) {
        decoder.decodeSettleProposal(event).ifPresent(settle -> apply(settle, height));
    }

    private void apply(SettleProposalEvent event, long height) {
        Optional<Proposal> found = proposalRepository.findById(event.proposal());
        if (found.isEmpty()) {
            log.warn("Settle event at height {} for unknown proposal {}, skipped", height, event.proposal());
            return;
        }
        Proposal proposal = found.get();
        if (proposal.isSettled()) {
            log.warn("Proposal {} already settled at height {}, ignoring settle event at height {}",
                    proposal.getId(), proposal.getSettleHeight(), height);
            return;
        }
        proposal.setStatus(event.state());
        proposal.setSettleHeight(height);
        proposalRepository.save(proposal);
        log.info("Proposal {} settled at height {} with state {}", proposal.getId(), height, event.state());
    }
}

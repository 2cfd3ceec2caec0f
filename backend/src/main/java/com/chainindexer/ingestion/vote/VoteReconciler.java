package com.chainindexer.ingestion.vote;

import com.chainindexer.domain.Grant;
import com.chainindexer.domain.GrantRepository;
import com.chainindexer.domain.GrantVote;
import com.chainindexer.domain.GrantVoteRepository;
import com.chainindexer.domain.Proposal;
import com.chainindexer.domain.ProposalRepository;
import com.chainindexer.domain.ProposalVote;
import com.chainindexer.domain.ProposalVoteRepository;
import com.chainindexer.domain.SequenceGenerator;
import com.chainindexer.ingestion.account.AccountLookup;
import com.chainindexer.ingestion.adapter.CometRpcService;
import com.chainindexer.ingestion.adapter.model.Commit;
import com.chainindexer.ingestion.adapter.model.CommitSignature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a height's commit signatures into vote rows for the proposal or grant decided at that height.
 *
 * <p>Match priority: proposal created at the height, then proposal settled at the height, then grant at the
 * height. Only the first match is reconciled. A row is inserted per signer unless one already exists for
 * (height, voterIndex), so re-running a height inserts nothing new. An unknown signer fails the whole height
 * with UnknownSignerException; rows inserted before the failure stay and are skipped on retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoteReconciler {

    private final CometRpcService cometRpcService;
    private final AccountLookup accountLookup;
    private final ProposalRepository proposalRepository;
    private final GrantRepository grantRepository;
    private final ProposalVoteRepository proposalVoteRepository;
    private final GrantVoteRepository grantVoteRepository;
    private final SequenceGenerator sequenceGenerator;

    public ReconcileResult reconcile(long height) {
        Optional<Proposal> created = proposalRepository.findFirstByNewHeight(height);
        if (created.isPresent()) {
            return reconcileProposal(created.get(), height, VoteKind.PROPOSAL_ADMISSION);
        }
        Optional<Proposal> settled = proposalRepository.findFirstBySettleHeight(height);
        if (settled.isPresent()) {
            return reconcileProposal(settled.get(), height, VoteKind.PROPOSAL_SETTLEMENT);
        }
        Optional<Grant> grant = grantRepository.findFirstByHeight(height);
        if (grant.isPresent()) {
            return reconcileGrant(grant.get(), height);
        }
        return ReconcileResult.none(height);
    }

    private ReconcileResult reconcileProposal(Proposal proposal, long height, VoteKind kind) {
        Commit commit = cometRpcService.commit(height);
        int inserted = 0;
        int skipped = 0;
        for (CommitSignature signature : commit.signatures()) {
            if (!signature.hasSigner()) {
                skipped++;
                continue;
            }
            long voterIndex = accountLookup.resolve(signature.validatorAddress());
            if (proposalVoteRepository.existsByHeightAndVoterIndex(height, voterIndex)) {
                skipped++;
                continue;
            }
            ProposalVote vote = new ProposalVote();
            vote.setId(sequenceGenerator.next(ProposalVote.SEQUENCE_NAME));
            vote.setProposal(proposal.getId());
            vote.setVoterIndex(voterIndex);
            vote.setVoterAddress(signature.validatorAddress());
            vote.setHeight(height);
            vote.setVote(signature.voteCode());
            proposalVoteRepository.save(vote);
            inserted++;
        }
        log.info("{} votes on proposal {} at height {}: {} inserted, {} skipped",
                kind, proposal.getId(), height, inserted, skipped);
        return new ReconcileResult(height, kind, proposal.getId(), inserted, skipped);
    }

    private ReconcileResult reconcileGrant(Grant grant, long height) {
        Commit commit = cometRpcService.commit(height);
        int inserted = 0;
        int skipped = 0;
        for (CommitSignature signature : commit.signatures()) {
            if (!signature.hasSigner()) {
                skipped++;
                continue;
            }
            long voterIndex = accountLookup.resolve(signature.validatorAddress());
            if (grantVoteRepository.existsByHeightAndVoterIndex(height, voterIndex)) {
                skipped++;
                continue;
            }
            GrantVote vote = new GrantVote();
            vote.setId(sequenceGenerator.next(GrantVote.SEQUENCE_NAME));
            vote.setProposerIndex(grant.getProposerIndex());
            vote.setProposerAddress(grant.getProposerAddress());
            vote.setAccountIndex(grant.getId());
            vote.setAccountAddress(grant.getAddress());
            vote.setVoterIndex(voterIndex);
            vote.setVoterAddress(signature.validatorAddress());
            vote.setHeight(height);
            vote.setVote(signature.voteCode());
            grantVoteRepository.save(vote);
            inserted++;
        }
        log.info("Grant votes on validator {} at height {}: {} inserted, {} skipped",
                grant.getId(), height, inserted, skipped);
        return new ReconcileResult(height, VoteKind.GRANT, grant.getId(), inserted, skipped);
    }
}

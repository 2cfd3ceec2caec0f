package com.chainindexer.query;

import com.chainindexer.domain.GrantVote;
import com.chainindexer.domain.GrantVoteRepository;
import com.chainindexer.domain.ProposalVote;
import com.chainindexer.domain.ProposalVoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Votes cast by one validator address, as recorded from commit signatures. Addresses are stored as uppercase hex
 * without a prefix, so the requested address is normalized the same way before matching.
 */
@Service
@RequiredArgsConstructor
public class VoteQueryService {

    private final ProposalVoteRepository proposalVoteRepository;
    private final GrantVoteRepository grantVoteRepository;
    private final PageRequests pageRequests;

    public ResultPage<ProposalVote> findProposalVotesByVoter(String voterAddress, Integer page, Integer size) {
        return ResultPage.of(proposalVoteRepository.findByVoterAddress(normalize(voterAddress), pageRequests.newestFirst(page, size)));
    }

    public ResultPage<GrantVote> findGrantVotesByVoter(String voterAddress, Integer page, Integer size) {
        return ResultPage.of(grantVoteRepository.findByVoterAddress(normalize(voterAddress), pageRequests.newestFirst(page, size)));
    }

    static String normalize(String address) {
        String trimmed = address.trim();
        String digits = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        return digits.toUpperCase(Locale.ROOT);
    }
}

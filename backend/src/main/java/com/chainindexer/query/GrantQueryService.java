package com.chainindexer.query;

import com.chainindexer.domain.Grant;
import com.chainindexer.domain.GrantRepository;
import com.chainindexer.domain.GrantVote;
import com.chainindexer.domain.GrantVoteRepository;
import com.chainindexer.domain.Validator;
import com.chainindexer.domain.ValidatorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Read-only grant and validator views. A grant's id is the index of the validator it is about.
 */
@Service
@RequiredArgsConstructor
public class GrantQueryService {

    private final GrantRepository grantRepository;
    private final GrantVoteRepository grantVoteRepository;
    private final ValidatorRepository validatorRepository;
    private final PageRequests pageRequests;

    public ResultPage<Grant> findGrants(Integer page, Integer size) {
        return ResultPage.of(grantRepository.findAll(pageRequests.newestFirst(page, size)));
    }

    public Grant getGrant(long id) {
        return grantRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Grant", id));
    }

    public ResultPage<GrantVote> findVotes(long grantId, Integer page, Integer size) {
        Pageable pageable = pageRequests.newestFirst(page, size);
        if (!grantRepository.existsById(grantId)) {
            throw new EntityNotFoundException("Grant", grantId);
        }
        return ResultPage.of(grantVoteRepository.findByAccountIndex(grantId, pageable));
    }

    public Validator getValidator(long index) {
        return validatorRepository.findById(index)
                .orElseThrow(() -> new EntityNotFoundException("Validator", index));
    }
}

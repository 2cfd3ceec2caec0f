package com.chainindexer.query;

import com.chainindexer.advisory.AdvisoryAgentClient;
import com.chainindexer.advisory.VoteRecommendation;
import com.chainindexer.domain.DiscussionRepository;
import com.chainindexer.domain.Proposal;
import com.chainindexer.domain.ProposalRepository;
import com.chainindexer.domain.ProposalVoteRepository;
import com.chainindexer.query.config.QueryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProposalQueryServiceTest {

    @Mock
    private ProposalRepository proposalRepository;
    @Mock
    private DiscussionRepository discussionRepository;
    @Mock
    private ProposalVoteRepository proposalVoteRepository;
    @Mock
    private AdvisoryAgentClient advisoryAgentClient;

    private ProposalQueryService service;
    private RecommendationService recommendationService;

    @BeforeEach
    void setUp() {
        service = new ProposalQueryService(proposalRepository, discussionRepository, proposalVoteRepository,
                new PageRequests(new QueryProperties()));
        recommendationService = new RecommendationService(service, null, advisoryAgentClient);
    }

    private static Proposal proposal(long id) {
        Proposal p = new Proposal();
        p.setId(id);
        return p;
    }

    @Test
    @DisplayName("blank proposer filter lists all proposals")
    void blankFilterListsAll() {
        when(proposalRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(proposal(3L), proposal(2L)), PageRequest.of(0, 2), 5));

        ResultPage<Proposal> page = service.findProposals(0, 2, " ");

        assertThat(page.total()).isEqualTo(5L);
        assertThat(page.items()).extracting(Proposal::getId).containsExactly(3L, 2L);
    }

    @Test
    @DisplayName("proposer filter is applied")
    void proposerFilter() {
        when(proposalRepository.findByProposerAddress(eq("A1A1"), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(proposal(1L))));

        assertThat(service.findProposals(null, null, "A1A1").items()).hasSize(1);
    }

    @Test
    @DisplayName("votes of a missing proposal are not found")
    void votesOfMissingProposal() {
        when(proposalRepository.existsById(9L)).thenReturn(false);

        assertThatThrownBy(() -> service.findVotes(9L, 0, 10)).isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(proposalVoteRepository);
    }

    @Test
    @DisplayName("recommendation asks the agent only for stored proposals")
    void recommendation() {
        when(proposalRepository.findById(7L)).thenReturn(Optional.of(proposal(7L)));
        when(proposalRepository.findById(8L)).thenReturn(Optional.empty());
        when(advisoryAgentClient.recommendProposalVote(7L, "AA01")).thenReturn(VoteRecommendation.yes("fine"));

        assertThat(recommendationService.recommendProposalVote(7L, "AA01").approved()).isTrue();
        assertThatThrownBy(() -> recommendationService.recommendProposalVote(8L, "AA01"))
                .isInstanceOf(EntityNotFoundException.class);
        verify(advisoryAgentClient).recommendProposalVote(7L, "AA01");
    }
}

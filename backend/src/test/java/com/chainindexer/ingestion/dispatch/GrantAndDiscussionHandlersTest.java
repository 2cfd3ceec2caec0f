package com.chainindexer.ingestion.dispatch;

import com.chainindexer.advisory.AdvisoryNotifier;
import com.chainindexer.domain.Discussion;
import com.chainindexer.domain.DiscussionRepository;
import com.chainindexer.domain.Grant;
import com.chainindexer.domain.GrantRepository;
import com.chainindexer.domain.SequenceGenerator;
import com.chainindexer.domain.Validator;
import com.chainindexer.domain.ValidatorRepository;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.adapter.model.EventAttribute;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GrantAndDiscussionHandlersTest {

    @Mock
    private ValidatorRepository validatorRepository;
    @Mock
    private GrantRepository grantRepository;
    @Mock
    private DiscussionRepository discussionRepository;
    @Mock
    private SequenceGenerator sequenceGenerator;
    @Mock
    private AdvisoryNotifier advisoryNotifier;

    private GrantEventHandler grantHandler;
    private DiscussionEventHandler discussionHandler;

    @BeforeEach
    void setUp() {
        ChainEventDecoder decoder = new ChainEventDecoder(false);
        grantHandler = new GrantEventHandler(decoder, validatorRepository, grantRepository);
        discussionHandler = new DiscussionEventHandler(decoder, discussionRepository, sequenceGenerator, advisoryNotifier);
    }

    @Test
    @DisplayName("grant upserts validator and grant keyed by validator index")
    void grantUpsertsValidatorAndGrant() {
        Validator existing = new Validator();
        existing.setId(4L);
        existing.setAddress("OLD");
        when(validatorRepository.findById(4L)).thenReturn(Optional.of(existing));
        ChainEvent event = new ChainEvent("grant", List.of(
                new EventAttribute("validator", "4"),
                new EventAttribute("address", "AB12"),
                new EventAttribute("amount", "500"),
                new EventAttribute("proposer", "1"),
                new EventAttribute("proposer_address", "EF34"),
                new EventAttribute("grant", "true"),
                new EventAttribute("agent_url", "http://agent-4")));

        grantHandler.handle(event, 42L);

        ArgumentCaptor<Validator> validator = ArgumentCaptor.forClass(Validator.class);
        verify(validatorRepository).save(validator.capture());
        assertThat(validator.getValue()).isSameAs(existing);
        assertThat(existing.getAddress()).isEqualTo("AB12");
        assertThat(existing.getAgentUrl()).isEqualTo("http://agent-4");
        assertThat(existing.getStake()).isEqualByComparingTo(new BigDecimal("500"));

        ArgumentCaptor<Grant> grant = ArgumentCaptor.forClass(Grant.class);
        verify(grantRepository).save(grant.capture());
        assertThat(grant.getValue().getId()).isEqualTo(4L);
        assertThat(grant.getValue().getHeight()).isEqualTo(42L);
        assertThat(grant.getValue().getProposerAddress()).isEqualTo("EF34");
        assertThat(grant.getValue().isGrant()).isTrue();
    }

    @Test
    @DisplayName("discussion is appended with a sequence id and sent to the agent")
    void discussionAppended() {
        when(sequenceGenerator.next(Discussion.SEQUENCE_NAME)).thenReturn(12L);
        ChainEvent event = new ChainEvent("discussion", List.of(
                new EventAttribute("proposal", "7"),
                new EventAttribute("speaker", "3"),
                new EventAttribute("speaker_address", "BB02"),
                new EventAttribute("data", "6f6b")));

        discussionHandler.handle(event, 101L);

        ArgumentCaptor<Discussion> saved = ArgumentCaptor.forClass(Discussion.class);
        verify(discussionRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(12L);
        assertThat(saved.getValue().getProposal()).isEqualTo(7L);
        assertThat(saved.getValue().getHeight()).isEqualTo(101L);
        assertThat(new String(saved.getValue().getData(), StandardCharsets.UTF_8)).isEqualTo("ok");
        verify(advisoryNotifier).discussionAdded(eq(7L), eq("BB02"), any(byte[].class));
    }

    @Test
    @DisplayName("replaying a height does not append or send a stored discussion again")
    void replayedDiscussionSkipped() {
        when(sequenceGenerator.next(Discussion.SEQUENCE_NAME)).thenReturn(12L);
        when(discussionRepository.existsByHeightAndProposalAndSpeakerIndexAndData(
                eq(101L), eq(7L), eq(3L), any(byte[].class)))
                .thenReturn(false)
                .thenReturn(true);
        ChainEvent event = new ChainEvent("discussion", List.of(
                new EventAttribute("proposal", "7"),
                new EventAttribute("speaker", "3"),
                new EventAttribute("speaker_address", "BB02"),
                new EventAttribute("data", "6f6b")));

        discussionHandler.handle(event, 101L);
        discussionHandler.handle(event, 101L);

        verify(discussionRepository, times(1)).save(any(Discussion.class));
        verify(sequenceGenerator, times(1)).next(Discussion.SEQUENCE_NAME);
        verify(advisoryNotifier, times(1)).discussionAdded(eq(7L), eq("BB02"), any(byte[].class));
    }
}

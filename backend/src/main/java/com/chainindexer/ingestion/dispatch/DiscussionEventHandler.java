package com.chainindexer.ingestion.dispatch;

import com.chainindexer.advisory.AdvisoryNotifier;
import com.chainindexer.domain.Discussion;
import com.chainindexer.domain.DiscussionRepository;
import com.chainindexer.domain.SequenceGenerator;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import com.chainindexer.ingestion.decoder.ChainEventType;
import com.chainindexer.ingestion.decoder.DiscussionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Appends a discussion message and hands it to the advisory agent. A message already stored for the same
 * height, proposal and speaker is not appended or sent again when the height is replayed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscussionEventHandler implements ChainEventHandler {

    private final ChainEventDecoder decoder;
    private final DiscussionRepository discussionRepository;
    private final SequenceGenerator sequenceGenerator;
    private final AdvisoryNotifier advisoryNotifier;

    @Override
    public ChainEventType eventType() {
        return ChainEventType.DISCUSSION;
    }

    @Override
    public void handle(ChainEvent event, long height) {
        decoder.decodeDiscussion(event).ifPresent(discussion -> apply(discussion, height));
    }

    private void apply(DiscussionEvent event, long height) {
        if (discussionRepository.existsByHeightAndProposalAndSpeakerIndexAndData(
                height, event.proposal(), event.speaker(), event.data())) {
            log.debug("Discussion on proposal {} by {} at height {} already stored", event.proposal(),
                    event.speakerAddress(), height);
            return;
        }
        Discussion discussion = new Discussion();
        discussion.setId(sequenceGenerator.next(Discussion.SEQUENCE_NAME));
        discussion.setProposal(event.proposal());
        discussion.setSpeakerIndex(event.speaker());
        discussion.setSpeakerAddress(event.speakerAddress());
        discussion.setData(event.data());
        discussion.setHeight(height);
        discussionRepository.save(discussion);
        log.info("Discussion {} on proposal {} by {} at height {}",
                discussion.getId(), event.proposal(), event.speakerAddress(), height);

        try {
            advisoryNotifier.discussionAdded(event.proposal(), event.speakerAddress(), event.data());
        } catch (RuntimeException e) {
            log.warn("Agent notification for discussion on proposal {} not queued: {}", event.proposal(), e.getMessage());
        }
    }
}

package com.chainindexer.advisory;

import com.chainindexer.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Fire-and-forget agent notifications for newly indexed proposals and discussions. Runs on the single
 * advisory-executor thread; every failure is logged here and never reaches the sync loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvisoryNotifier {

    private final AdvisoryAgentClient advisoryAgentClient;

    @Async(AsyncConfig.ADVISORY_EXECUTOR)
    public void proposalCreated(long proposalId, String proposerAddress, byte[] data) {
        try {
            advisoryAgentClient.submitProposal(proposalId, proposerAddress, text(data));
        } catch (RuntimeException e) {
            log.warn("Add proposal {} to agent failed: {}", proposalId, e.getMessage());
        }
        try {
            advisoryAgentClient.commentProposal(proposalId, proposerAddress);
        } catch (RuntimeException e) {
            log.warn("Comment proposal {} via agent failed: {}", proposalId, e.getMessage());
        }
    }

    @Async(AsyncConfig.ADVISORY_EXECUTOR)
    public void discussionAdded(long proposalId, String speakerAddress, byte[] data) {
        try {
            advisoryAgentClient.submitDiscussion(proposalId, speakerAddress, text(data));
        } catch (RuntimeException e) {
            log.warn("Add discussion on proposal {} to agent failed: {}", proposalId, e.getMessage());
        }
    }

    private static String text(byte[] data) {
        return data == null ? "" : new String(data, StandardCharsets.UTF_8);
    }
}

package com.chainindexer.ingestion.dispatch;

import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainEventDispatcherTest {

    private static final class RecordingHandler implements ChainEventHandler {
        private final ChainEventType type;
        private final List<Long> heights = new ArrayList<>();
        private final boolean fail;

        RecordingHandler(ChainEventType type, boolean fail) {
            this.type = type;
            this.fail = fail;
        }

        @Override
        public ChainEventType eventType() {
            return type;
        }

        @Override
        public void handle(ChainEvent event, long height) {
            heights.add(height);
            if (fail) {
                throw new IllegalStateException("store down");
            }
        }
    }

    @Test
    @DisplayName("events are routed to the handler registered for their tag")
    void routesByTag() {
        RecordingHandler proposals = new RecordingHandler(ChainEventType.PROPOSAL, false);
        RecordingHandler grants = new RecordingHandler(ChainEventType.GRANT, false);
        ChainEventDispatcher dispatcher = new ChainEventDispatcher(List.of(proposals, grants));

        dispatcher.dispatch("proposal", new ChainEvent("proposal", List.of()), 10L);
        dispatcher.dispatch("grant", new ChainEvent("grant", List.of()), 11L);

        assertThat(proposals.heights).containsExactly(10L);
        assertThat(grants.heights).containsExactly(11L);
    }

    @Test
    @DisplayName("unknown tags are ignored")
    void unknownTagIgnored() {
        RecordingHandler proposals = new RecordingHandler(ChainEventType.PROPOSAL, false);
        ChainEventDispatcher dispatcher = new ChainEventDispatcher(List.of(proposals));

        dispatcher.dispatch("transfer", new ChainEvent("transfer", List.of()), 10L);
        dispatcher.dispatch("grant", new ChainEvent("grant", List.of()), 10L);

        assertThat(proposals.heights).isEmpty();
    }

    @Test
    @DisplayName("a failing handler does not propagate")
    void handlerFailureIsolated() {
        RecordingHandler failing = new RecordingHandler(ChainEventType.DISCUSSION, true);
        RecordingHandler proposals = new RecordingHandler(ChainEventType.PROPOSAL, false);
        ChainEventDispatcher dispatcher = new ChainEventDispatcher(List.of(failing, proposals));

        dispatcher.dispatch("discussion", new ChainEvent("discussion", List.of()), 5L);
        dispatcher.dispatch("proposal", new ChainEvent("proposal", List.of()), 5L);

        assertThat(failing.heights).containsExactly(5L);
        assertThat(proposals.heights).containsExactly(5L);
    }

    @Test
    @DisplayName("two handlers for one tag fail construction")
    void duplicateHandlersRejected() {
        List<ChainEventHandler> handlers = List.of(
                new RecordingHandler(ChainEventType.GRANT, false),
                new RecordingHandler(ChainEventType.GRANT, false));

        assertThatThrownBy(() -> new ChainEventDispatcher(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("grant");
    }
}

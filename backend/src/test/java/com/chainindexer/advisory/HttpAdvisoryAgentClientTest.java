package com.chainindexer.advisory;

import com.chainindexer.common.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpAdvisoryAgentClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private HttpAdvisoryAgentClient client(String agentId, Function<ClientRequest, ClientResponse> responder) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://agent:3000")
                .exchangeFunction(req -> {
                    requests.add(req);
                    return Mono.just(responder.apply(req));
                })
                .build();
        return new HttpAdvisoryAgentClient(webClient, new ObjectMapper(), Duration.ofSeconds(2),
                new RetryPolicy(0L, 0.0, 3), agentId);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "application/json")
                .body(body)
                .build();
    }

    @Test
    @DisplayName("agent id is resolved once from GET /agents and reused")
    void resolvesAgentIdOnce() {
        HttpAdvisoryAgentClient client = client(null, req -> req.url().getPath().equals("/agents")
                ? json("{\"agents\":[{\"id\":\"a-1\",\"name\":\"gov\"},{\"id\":\"a-2\"}]}")
                : json("ok"));

        client.submitProposal(7L, "AA01", "hello");
        client.submitDiscussion(7L, "BB02", "reply");

        assertThat(requests).extracting(r -> r.method() + " " + r.url().getPath())
                .containsExactly("GET /agents", "POST /a-1/proposal", "POST /a-1/discussion");
    }

    @Test
    @DisplayName("configured agent id skips discovery")
    void configuredAgentId() {
        HttpAdvisoryAgentClient client = client("fixed", req -> json("nice proposal"));

        String comment = client.commentProposal(7L, "AA01");

        assertThat(comment).isEqualTo("nice proposal");
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.method()).isEqualTo(HttpMethod.POST);
            assertThat(r.url().getPath()).isEqualTo("/fixed/newdiscussion");
        });
    }

    @Test
    @DisplayName("vote responses map to recommendations")
    void voteRecommendations() {
        HttpAdvisoryAgentClient client = client("fixed", req -> req.url().getPath().endsWith("/voteproposal")
                ? json("{\"vote\":\"yes\",\"reason\":\"improves liveness\"}")
                : json("{\"vote\":\"no\",\"reason\":\"stake too small\"}"));

        VoteRecommendation proposal = client.recommendProposalVote(7L, "AA01");
        VoteRecommendation grant = client.recommendGrantVote(4L, "EF34", new BigDecimal("500"), "");

        assertThat(proposal.approved()).isTrue();
        assertThat(proposal.reason()).isEqualTo("improves liveness");
        assertThat(grant.approved()).isFalse();
        assertThat(requests).extracting(r -> r.url().getPath())
                .containsExactly("/fixed/voteproposal", "/fixed/votegrant");
    }

    @Test
    @DisplayName("discovery is retried and a later success is used")
    void discoveryRetried() {
        AtomicInteger attempts = new AtomicInteger();
        HttpAdvisoryAgentClient client = client(null, req -> {
            if (req.url().getPath().equals("/agents")) {
                return attempts.incrementAndGet() < 3
                        ? ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()
                        : json("{\"agents\":[{\"id\":\"late\"}]}");
            }
            return json("ok");
        });

        client.submitProposal(1L, "AA01", "x");

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(requests.get(requests.size() - 1).url().getPath()).isEqualTo("/late/proposal");
    }

    @Test
    @DisplayName("server errors and unusable vote bodies become AgentException")
    void failuresBecomeAgentException() {
        HttpAdvisoryAgentClient failing = client("fixed",
                req -> ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build());
        HttpAdvisoryAgentClient garbled = client("fixed", req -> json("{\"reason\":\"no vote field\"}"));
        HttpAdvisoryAgentClient empty = client(null, req -> json("{\"agents\":[]}"));

        assertThatThrownBy(() -> failing.submitProposal(1L, "AA01", "x")).isInstanceOf(AgentException.class);
        assertThatThrownBy(() -> garbled.recommendProposalVote(1L, "AA01")).isInstanceOf(AgentException.class);
        assertThatThrownBy(() -> empty.submitProposal(1L, "AA01", "x"))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("no agents");
    }
}

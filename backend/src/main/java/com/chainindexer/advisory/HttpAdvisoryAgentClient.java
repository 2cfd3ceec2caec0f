package com.chainindexer.advisory;

import com.chainindexer.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory agent over HTTP + JSON. The agent id is taken from configuration or, when absent, resolved lazily from
 * {@code GET /agents} (first agent listed) with retries; a failed resolution is retried on the next call.
 *
 * <p>Endpoints, all POST with {@code {proposalId|grantId, validatorAddress, text}}:
 * {@code /{agentId}/proposal}, {@code /discussion}, {@code /newdiscussion} (comment),
 * {@code /voteproposal} and {@code /votegrant} (both answer {@code {vote, reason}}).
 */
@Slf4j
public class HttpAdvisoryAgentClient implements AdvisoryAgentClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final RetryPolicy agentIdRetryPolicy;
    private volatile String agentId;

    public HttpAdvisoryAgentClient(WebClient webClient, ObjectMapper objectMapper, Duration timeout,
                                   RetryPolicy agentIdRetryPolicy, String configuredAgentId) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.agentIdRetryPolicy = agentIdRetryPolicy;
        this.agentId = configuredAgentId != null && !configuredAgentId.isBlank() ? configuredAgentId.strip() : null;
    }

    @Override
    public void submitProposal(long proposalId, String proposerAddress, String text) {
        log.info("Submitting proposal {} from {} to agent", proposalId, proposerAddress);
        post("proposal", body("proposalId", proposalId, proposerAddress, text));
    }

    @Override
    public void submitDiscussion(long proposalId, String speakerAddress, String text) {
        log.info("Submitting discussion on proposal {} from {} to agent", proposalId, speakerAddress);
        post("discussion", body("proposalId", proposalId, speakerAddress, text));
    }

    @Override
    public String commentProposal(long proposalId, String speakerAddress) {
        String comment = post("newdiscussion", body("proposalId", proposalId, speakerAddress, "comment"));
        log.info("Agent comment on proposal {}: {}", proposalId, comment);
        return comment;
    }

    @Override
    public VoteRecommendation recommendProposalVote(long proposalId, String voterAddress) {
        String json = post("voteproposal", body("proposalId", proposalId, voterAddress, "analyze proposal"));
        VoteRecommendation recommendation = parseRecommendation(json);
        log.info("Agent vote on proposal {} for {}: {} ({})", proposalId, voterAddress,
                recommendation.vote(), recommendation.reason());
        return recommendation;
    }

    @Override
    public VoteRecommendation recommendGrantVote(long validatorIndex, String proposerAddress, BigDecimal amount, String statement) {
        Map<String, Object> body = body("grantId", validatorIndex, proposerAddress, statement);
        body.put("amount", amount != null ? amount.toPlainString() : "0");
        String json = post("votegrant", body);
        VoteRecommendation recommendation = parseRecommendation(json);
        log.info("Agent vote on grant {} proposed by {}: {} ({})", validatorIndex, proposerAddress,
                recommendation.vote(), recommendation.reason());
        return recommendation;
    }

    String agentId() {
        String current = agentId;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (agentId == null) {
                agentId = agentIdRetryPolicy.execute(this::fetchFirstAgentId);
                log.info("Advisory agent id resolved: {}", agentId);
            }
            return agentId;
        }
    }

    private String fetchFirstAgentId() {
        String json = exchange(webClient.get().uri("/agents"), "GET /agents");
        try {
            JsonNode agents = objectMapper.readTree(json).path("agents");
            for (JsonNode agent : agents) {
                String id = agent.path("id").asText("");
                if (!id.isBlank()) {
                    return id;
                }
            }
        } catch (Exception e) {
            throw new AgentException("Unparseable /agents response", e);
        }
        throw new AgentException("Agent service lists no agents");
    }

    private String post(String action, Map<String, Object> body) {
        String path = "/" + agentId() + "/" + action;
        return exchange(webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body), "POST " + path);
    }

    private String exchange(WebClient.RequestHeadersSpec<?> request, String description) {
        try {
            String response = request.retrieve().bodyToMono(String.class).block(timeout);
            return response != null ? response : "";
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentException(description + " failed: " + e.getMessage(), e);
        }
    }

    private VoteRecommendation parseRecommendation(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            String vote = root.path("vote").asText(null);
            if (vote == null) {
                throw new AgentException("Agent vote response has no vote: " + json);
            }
            return new VoteRecommendation(vote, root.path("reason").asText(""));
        } catch (AgentException e) {
            throw e;
        } catch (Exception e) {
            throw new AgentException("Unparseable agent vote response", e);
        }
    }

    private static Map<String, Object> body(String idField, long id, String address, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(idField, String.valueOf(id));
        body.put("validatorAddress", address);
        body.put("text", text != null ? text : "");
        return body;
    }
}

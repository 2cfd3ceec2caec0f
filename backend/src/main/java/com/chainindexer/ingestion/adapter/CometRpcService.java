package com.chainindexer.ingestion.adapter;

import com.chainindexer.ingestion.adapter.model.AbciQueryResult;
import com.chainindexer.ingestion.adapter.model.BlockResults;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.adapter.model.Commit;
import com.chainindexer.ingestion.adapter.model.CommitSignature;
import com.chainindexer.ingestion.adapter.model.EventAttribute;
import com.chainindexer.ingestion.adapter.model.TxResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Typed CometBFT RPC operations used by the indexer: status, block_results, commit, abci_query.
 * Parses responses with Jackson; a JSON-RPC {@code error} member or a missing field becomes RpcException.
 */
@RequiredArgsConstructor
public class CometRpcService {

    private final ChainConnection connection;
    private final ObjectMapper objectMapper;

    /**
     * Latest committed block height reported by the node.
     */
    public long currentHeight() {
        JsonNode result = result("status", Map.of());
        return parseLong(result.path("sync_info").path("latest_block_height"), "status.sync_info.latest_block_height");
    }

    public BlockResults blockResults(long height) {
        JsonNode result = result("block_results", Map.of("height", String.valueOf(height)));
        List<TxResult> txResults = new ArrayList<>();
        for (JsonNode tx : result.path("txs_results")) {
            List<ChainEvent> events = new ArrayList<>();
            for (JsonNode event : tx.path("events")) {
                events.add(toEvent(event));
            }
            txResults.add(new TxResult(tx.path("code").asInt(0), events));
        }
        return new BlockResults(height, txResults);
    }

    /**
     * Commit for the given height, signatures in validator-set order.
     */
    public Commit commit(long height) {
        JsonNode result = result("commit", Map.of("height", String.valueOf(height)));
        JsonNode commit = result.path("signed_header").path("commit");
        if (commit.isMissingNode()) {
            throw new RpcException("commit " + height + ": missing signed_header.commit");
        }
        List<CommitSignature> signatures = new ArrayList<>();
        for (JsonNode sig : commit.path("signatures")) {
            String address = sig.path("validator_address").asText("");
            // chain-specific vote code wins over the generic block id flag
            int voteCode = sig.has("vote_code") ? sig.path("vote_code").asInt() : sig.path("block_id_flag").asInt();
            signatures.add(new CommitSignature(address, voteCode));
        }
        long commitHeight = commit.has("height") ? parseLong(commit.path("height"), "commit.height") : height;
        return new Commit(commitHeight, signatures);
    }

    /**
     * Point query against application state. {@code key} is sent hex-encoded.
     */
    public AbciQueryResult abciQuery(String path, byte[] key) {
        JsonNode result = result("abci_query", Map.of("path", path, "data", HexFormat.of().formatHex(key)));
        JsonNode response = result.path("response");
        if (response.isMissingNode()) {
            throw new RpcException("abci_query " + path + ": missing response");
        }
        String encoded = response.path("value").asText("");
        byte[] value;
        try {
            value = encoded.isEmpty() ? new byte[0] : Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new RpcException("abci_query " + path + ": value is not base64", e);
        }
        return new AbciQueryResult(response.path("code").asLong(0), value, response.path("log").asText(""));
    }

    private JsonNode result(String method, Map<String, Object> params) {
        String json = connection.call(method, params);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return result;
    }

    private static ChainEvent toEvent(JsonNode event) {
        List<EventAttribute> attributes = new ArrayList<>();
        for (JsonNode attr : event.path("attributes")) {
            attributes.add(new EventAttribute(attr.path("key").asText(""), attr.path("value").asText("")));
        }
        return new ChainEvent(event.path("type").asText(""), attributes);
    }

    private static long parseLong(JsonNode node, String field) {
        String text = node.asText(null);
        if (text == null || text.isBlank()) {
            throw new RpcException("Missing " + field);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid " + field + ": " + text, e);
        }
    }
}

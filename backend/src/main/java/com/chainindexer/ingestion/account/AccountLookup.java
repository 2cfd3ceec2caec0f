package com.chainindexer.ingestion.account;

import com.chainindexer.config.CaffeineConfig;
import com.chainindexer.ingestion.adapter.CometRpcService;
import com.chainindexer.ingestion.adapter.RpcException;
import com.chainindexer.ingestion.adapter.model.AbciQueryResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HexFormat;

/**
 * Resolves a validator address to its stable index with an ABCI point query on {@code /accounts/}.
 * Only successful resolutions are cached; an exception leaves the cache untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLookup {

    static final String ACCOUNTS_PATH = "/accounts/";

    private final CometRpcService cometRpcService;
    private final ObjectMapper objectMapper;

    /**
     * @param address hex validator address as it appears in commit signatures
     * @return the validator index
     * @throws UnknownSignerException when the chain does not know the address
     * @throws RpcException           when the query itself fails
     */
    @Cacheable(cacheNames = CaffeineConfig.ACCOUNT_INDEX_CACHE, key = "#address.toUpperCase()")
    public long resolve(String address) {
        byte[] key = decodeAddress(address);
        AbciQueryResult result = cometRpcService.abciQuery(ACCOUNTS_PATH, key);
        if (!result.isOk()) {
            throw new UnknownSignerException(address, "abci_query code " + result.code() + " " + result.log());
        }
        if (!result.hasValue()) {
            throw new UnknownSignerException(address, "no account stored");
        }
        long index = parseIndex(address, result.value());
        log.debug("Resolved signer {} to validator {}", address, index);
        return index;
    }

    private static byte[] decodeAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new UnknownSignerException(String.valueOf(address), "empty address");
        }
        String hex = address.startsWith("0x") || address.startsWith("0X") ? address.substring(2) : address;
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new UnknownSignerException(address, "address is not hex");
        }
    }

    private long parseIndex(String address, byte[] value) {
        JsonNode index;
        try {
            index = objectMapper.readTree(value).path("index");
        } catch (IOException e) {
            throw new RpcException("Unparseable account for " + address, e);
        }
        if (index.isIntegralNumber() && index.canConvertToLong() && index.asLong() >= 0) {
            return index.asLong();
        }
        if (index.isTextual()) {
            try {
                return Long.parseUnsignedLong(index.asText());
            } catch (NumberFormatException e) {
                throw new RpcException("Account for " + address + " has invalid index " + index.asText(), e);
            }
        }
        throw new RpcException("Account for " + address + " has no index");
    }
}

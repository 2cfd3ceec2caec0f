package com.chainindexer.ingestion.decoder;

import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.adapter.model.EventAttribute;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw chain events to typed governance events. Every required attribute must be present and well formed,
 * otherwise the result is empty and the reason is logged; there are no partial results.
 *
 * <p>Attribute schemas:
 * <ul>
 *   <li>grant: validator, address, amount, proposer, proposer_address, grant, optional agent_url</li>
 *   <li>discussion: proposal, speaker, speaker_address, data (hex)</li>
 *   <li>proposal: proposal, proposer, proposer_address, data (hex), status</li>
 *   <li>settle_proposal: proposal, state</li>
 * </ul>
 */
@Slf4j
public class ChainEventDecoder {

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final boolean base64Attributes;

    public ChainEventDecoder(boolean base64Attributes) {
        this.base64Attributes = base64Attributes;
    }

    public Optional<GrantEvent> decodeGrant(ChainEvent event) {
        return decodeAs(event, ChainEventType.GRANT, attrs -> new GrantEvent(
                index(attrs, "validator"),
                text(attrs, "address"),
                uint64(attrs, "amount"),
                index(attrs, "proposer"),
                text(attrs, "proposer_address"),
                bool(attrs, "grant"),
                attrs.getOrDefault("agent_url", "")));
    }

    public Optional<DiscussionEvent> decodeDiscussion(ChainEvent event) {
        return decodeAs(event, ChainEventType.DISCUSSION, attrs -> new DiscussionEvent(
                index(attrs, "proposal"),
                index(attrs, "speaker"),
                text(attrs, "speaker_address"),
                hex(attrs, "data")));
    }

    public Optional<ProposalEvent> decodeProposal(ChainEvent event) {
        return decodeAs(event, ChainEventType.PROPOSAL, attrs -> new ProposalEvent(
                index(attrs, "proposal"),
                index(attrs, "proposer"),
                text(attrs, "proposer_address"),
                hex(attrs, "data"),
                index(attrs, "status")));
    }

    public Optional<SettleProposalEvent> decodeSettleProposal(ChainEvent event) {
        return decodeAs(event, ChainEventType.SETTLE_PROPOSAL, attrs -> new SettleProposalEvent(
                index(attrs, "proposal"),
                index(attrs, "state")));
    }

    private <T> Optional<T> decodeAs(ChainEvent event, ChainEventType expected, AttributeMapper<T> mapper) {
        if (event == null || !expected.tag().equals(event.type())) {
            log.warn("Cannot decode {} from event type {}", expected.tag(), event != null ? event.type() : null);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.map(attributes(event)));
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed {} event: {}", expected.tag(), e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, String> attributes(ChainEvent event) {
        Map<String, String> attrs = new HashMap<>();
        for (EventAttribute attribute : event.attributes()) {
            String key = base64Attributes ? fromBase64(attribute.key()) : attribute.key();
            String value = base64Attributes ? fromBase64(attribute.value()) : attribute.value();
            if (key != null) {
                attrs.put(key, value != null ? value : "");
            }
        }
        return attrs;
    }

    private static String fromBase64(String encoded) {
        if (encoded == null) {
            return null;
        }
        try {
            return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("attribute is not base64: " + encoded);
        }
    }

    private static String required(Map<String, String> attrs, String key) {
        String value = attrs.get(key);
        if (value == null) {
            throw new MalformedEventException("missing " + key);
        }
        return value.strip();
    }

    private static String text(Map<String, String> attrs, String key) {
        String value = required(attrs, key);
        if (value.isEmpty()) {
            throw new MalformedEventException("empty " + key);
        }
        return value;
    }

    private static long index(Map<String, String> attrs, String key) {
        String value = required(attrs, key);
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new MalformedEventException(key + " is negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedEventException(key + " is not an integer: " + value);
        }
    }

    private static BigDecimal uint64(Map<String, String> attrs, String key) {
        String value = required(attrs, key);
        try {
            BigInteger parsed = new BigInteger(value);
            if (parsed.signum() < 0 || parsed.compareTo(MAX_UINT64) > 0) {
                throw new MalformedEventException(key + " out of uint64 range: " + value);
            }
            return new BigDecimal(parsed);
        } catch (NumberFormatException e) {
            throw new MalformedEventException(key + " is not an integer: " + value);
        }
    }

    private static boolean bool(Map<String, String> attrs, String key) {
        String value = required(attrs, key);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new MalformedEventException(key + " is not a boolean: " + value);
    }

    private static byte[] hex(Map<String, String> attrs, String key) {
        String value = required(attrs, key);
        String digits = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        try {
            return HexFormat.of().parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(key + " is not hex");
        }
    }

    @FunctionalInterface
    private interface AttributeMapper<T> {
        T map(Map<String, String> attrs);
    }

    private static final class MalformedEventException extends RuntimeException {
        MalformedEventException(String message) {
            super(message);
        }
    }
}

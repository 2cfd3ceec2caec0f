package com.chainindexer.api.dto;

import com.chainindexer.domain.Discussion;

import java.util.HexFormat;

public record DiscussionResponse(long id, long proposal, long speakerIndex, String speakerAddress, String data, long height) {

    public static DiscussionResponse from(Discussion d) {
        return new DiscussionResponse(
                d.getId(),
                d.getProposal(),
                d.getSpeakerIndex(),
                d.getSpeakerAddress(),
                d.getData() != null ? HexFormat.of().formatHex(d.getData()) : "",
                d.getHeight());
    }
}

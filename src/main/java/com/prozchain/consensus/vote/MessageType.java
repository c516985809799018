package com.prozchain.consensus.vote;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum MessageType {

    PROPOSAL(0),
    VOTE(1);

    MessageType(int tag) {
        this.tag = tag;
    }

    private final int tag;

    public static MessageType getByTag(int tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag == tag)
                .findFirst()
                .orElse(null);
    }
}

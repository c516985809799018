package com.prozchain.consensus.vote;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum VoteType {

    PREVOTE(1),
    PRECOMMIT(2),
    UNKNOWN(-1);

    VoteType(int code) {
        this.code = code;
    }

    private final int code;

    public static VoteType getByCode(int code) {
        return Arrays.stream(values())
                .filter(t -> t.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }
}

package com.prozchain.consensus.pool;

public enum RejectReason {
    MALFORMED,
    UNKNOWN_VALIDATOR,
    WRONG_PROPOSER,
    BLOCK_HASH_MISMATCH,
    INVALID_SIGNATURE,
    HEIGHT_OUT_OF_WINDOW,
    ROUND_OUT_OF_WINDOW
}

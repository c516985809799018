package com.prozchain.consensus.state;

public enum Step {
    PROPOSE,
    PREVOTE,
    PRECOMMIT,
    COMMIT
}

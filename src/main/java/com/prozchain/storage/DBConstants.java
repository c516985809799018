package com.prozchain.storage;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class DBConstants {

    // Consensus safety state
    public static final String LAST_COMMITTED_HEIGHT = "cs::lastCommittedHeight";
    public static final String CURRENT_HEIGHT = "cs::currentHeight";
    public static final String CURRENT_ROUND = "cs::currentRound";
    public static final String LOCKED_VALUE = "cs::lockedValue";
    public static final String LOCKED_ROUND = "cs::lockedRound";

    // Committed blocks
    public static final String COMMITTED_HASH_PREFIX = "bs::hash::";
    public static final String COMMITTED_CERTIFICATE_PREFIX = "bs::cert::";
}

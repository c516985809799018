package com.prozchain.network;

import com.prozchain.consensus.vote.ConsensusMessage;

@FunctionalInterface
public interface ConsensusMessageHandler {

    void deliver(ConsensusMessage message);
}

package com.prozchain.network;

import com.prozchain.consensus.vote.ConsensusMessage;

/**
 * Gossip of consensus messages. Delivery is best effort and unordered.
 */
public interface NetworkService {

    void broadcast(ConsensusMessage message);

    void registerHandler(ConsensusMessageHandler handler);
}

package com.prozchain.network;

import java.util.Set;

/**
 * Raw byte transport to connected peers.
 */
public interface PeerTransport {

    Set<String> getPeerIds();

    void send(String peerId, byte[] message);
}

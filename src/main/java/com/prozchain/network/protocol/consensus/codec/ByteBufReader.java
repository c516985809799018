package com.prozchain.network.protocol.consensus.codec;

import io.netty.buffer.ByteBuf;

public interface ByteBufReader<T> {

    /**
     * @throws com.prozchain.exception.MessageDecodingException on malformed input
     */
    T read(ByteBuf buf);
}

package com.prozchain.network.protocol.consensus.codec;

import io.netty.buffer.ByteBuf;

public interface ByteBufWriter<T> {

    void write(ByteBuf buf, T value);
}

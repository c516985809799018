package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.block.Block;
import io.netty.buffer.ByteBuf;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BlockWriter implements ByteBufWriter<Block> {

    private static final BlockWriter INSTANCE = new BlockWriter();

    public static BlockWriter getInstance() {
        return INSTANCE;
    }

    @Override
    public void write(ByteBuf buf, Block block) {
        buf.writeLongLE(block.getHeight());
        CodecUtils.writeBlockHash(buf, block.getParentHash());
        buf.writeLongLE(block.getTimestamp());
        buf.writeIntLE(block.getPayloadLength());
        buf.writeBytes(block.getPayload());
    }
}

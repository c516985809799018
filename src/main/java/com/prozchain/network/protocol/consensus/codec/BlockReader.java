package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.block.Block;
import com.prozchain.exception.MessageDecodingException;
import com.prozchain.types.BlockHash;
import io.netty.buffer.ByteBuf;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BlockReader implements ByteBufReader<Block> {

    public static final int MAX_PAYLOAD_BYTES = 4 * 1024 * 1024;

    private static final BlockReader INSTANCE = new BlockReader();

    public static BlockReader getInstance() {
        return INSTANCE;
    }

    @Override
    public Block read(ByteBuf buf) {
        long height = buf.readLongLE();
        BlockHash parentHash = CodecUtils.readBlockHash(buf);
        long timestamp = buf.readLongLE();

        int payloadLength = buf.readIntLE();
        if (payloadLength < 0 || payloadLength > MAX_PAYLOAD_BYTES) {
            throw new MessageDecodingException("Invalid block payload length " + payloadLength);
        }

        return new Block(height, parentHash, timestamp, CodecUtils.readBytes(buf, payloadLength));
    }
}

package com.prozchain.block;

import com.prozchain.network.protocol.consensus.codec.BlockWriter;
import com.prozchain.network.protocol.consensus.codec.CodecUtils;
import com.prozchain.types.BlockHash;
import com.prozchain.utils.HashUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * Opaque block as seen by consensus. Content construction and execution belong to the {@code BlockExecutor};
 * consensus only needs the height, the parent link and a stable hash over the encoding.
 */
@Getter
@EqualsAndHashCode
public final class Block {

    private final long height;
    private final BlockHash parentHash;
    private final long timestamp;
    private final byte[] payload;

    private transient BlockHash hash;

    public Block(long height, BlockHash parentHash, long timestamp, byte[] payload) {
        this.height = height;
        this.parentHash = parentHash;
        this.timestamp = timestamp;
        this.payload = Arrays.copyOf(payload, payload.length);
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int getPayloadLength() {
        return payload.length;
    }

    public BlockHash getHash() {
        if (hash == null) {
            byte[] encoded = CodecUtils.Encode.encode(BlockWriter.getInstance(), this);
            hash = new BlockHash(HashUtils.hashWithBlake2b(encoded));
        }
        return hash;
    }

    @Override
    public String toString() {
        return String.format("Block{height=%d, hash=%s, parent=%s}", height, getHash(), parentHash);
    }
}

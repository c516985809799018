package com.prozchain.types;

import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32-byte identifier of a block. A vote carrying no {@code BlockHash} is a nil vote.
 */
@EqualsAndHashCode
public final class BlockHash implements Serializable, Comparable<BlockHash> {

    public static final int SIZE_BYTES = 32;

    private final byte[] bytes;

    public BlockHash(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE_BYTES) {
            throw new IllegalArgumentException("Block hash must be exactly " + SIZE_BYTES + " bytes");
        }
        this.bytes = Arrays.copyOf(bytes, SIZE_BYTES);
    }

    public static BlockHash fromHex(String hex) {
        String stripped = hex.startsWith("0x") ? hex.substring(2) : hex;
        return new BlockHash(Hex.decode(stripped));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, SIZE_BYTES);
    }

    @Override
    public int compareTo(BlockHash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}

package com.prozchain.types;

import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

@EqualsAndHashCode
public final class Signature implements Serializable {

    public static final int SIZE_BYTES = 64;

    private final byte[] bytes;

    public Signature(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE_BYTES) {
            throw new IllegalArgumentException("Signature must be exactly " + SIZE_BYTES + " bytes");
        }
        this.bytes = Arrays.copyOf(bytes, SIZE_BYTES);
    }

    public static Signature empty() {
        return new Signature(new byte[SIZE_BYTES]);
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, SIZE_BYTES);
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}

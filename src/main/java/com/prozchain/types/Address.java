package com.prozchain.types;

import com.prozchain.utils.HashUtils;
import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 20-byte validator address, derived from the first bytes of the Blake2b-256 hash of the public key.
 */
@EqualsAndHashCode
public final class Address implements Serializable, Comparable<Address> {

    public static final int SIZE_BYTES = 20;

    private final byte[] bytes;

    public Address(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE_BYTES) {
            throw new IllegalArgumentException("Address must be exactly " + SIZE_BYTES + " bytes");
        }
        this.bytes = Arrays.copyOf(bytes, SIZE_BYTES);
    }

    public static Address fromPublicKey(byte[] publicKey) {
        return new Address(Arrays.copyOf(HashUtils.hashWithBlake2b(publicKey), SIZE_BYTES));
    }

    public static Address fromHex(String hex) {
        String stripped = hex.startsWith("0x") ? hex.substring(2) : hex;
        return new Address(Hex.decode(stripped));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, SIZE_BYTES);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}

package com.prozchain.utils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.bouncycastle.crypto.digests.Blake2bDigest;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class HashUtils {

    private static final int BLAKE2B_256_BITS = 256;

    /**
     * Hashes the input with Blake2b producing a 256-bit digest.
     *
     * @param input data to hash
     * @return 32-byte digest
     */
    public static byte[] hashWithBlake2b(byte[] input) {
        Blake2bDigest digest = new Blake2bDigest(BLAKE2B_256_BITS);
        digest.update(input, 0, input.length);

        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        return hash;
    }
}

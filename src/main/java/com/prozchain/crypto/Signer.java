package com.prozchain.crypto;

import com.prozchain.types.Signature;

/**
 * Signing port. Implementations hold the local validator key; verification is stateless and
 * safe to call from any thread.
 */
public interface Signer {

    Signature sign(byte[] message);

    boolean verify(byte[] publicKey, byte[] message, Signature signature);

    byte[] getPublicKey();
}

package com.prozchain.crypto;

import com.prozchain.types.Signature;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Ed25519SignerTest {

    private static final byte[] MESSAGE = "prevote".getBytes(StandardCharsets.UTF_8);

    @Test
    void signatureVerifiesAgainstSignerKey() {
        Ed25519Signer signer = Ed25519Signer.generate();

        Signature signature = signer.sign(MESSAGE);

        assertEquals(Signature.SIZE_BYTES, signature.getBytes().length);
        assertTrue(signer.verify(signer.getPublicKey(), MESSAGE, signature));
    }

    @Test
    void signatureDoesNotVerifyForOtherKeyOrMessage() {
        Ed25519Signer signer = Ed25519Signer.generate();
        Ed25519Signer other = Ed25519Signer.generate();
        Signature signature = signer.sign(MESSAGE);

        assertFalse(signer.verify(other.getPublicKey(), MESSAGE, signature));
        assertFalse(signer.verify(signer.getPublicKey(), "precommit".getBytes(StandardCharsets.UTF_8), signature));
    }

    @Test
    void malformedPublicKeyDoesNotVerify() {
        Ed25519Signer signer = Ed25519Signer.generate();

        assertFalse(signer.verify(new byte[5], MESSAGE, signer.sign(MESSAGE)));
    }

    @Test
    void sameSeedGivesSameKey() {
        byte[] seed = new byte[32];
        seed[0] = 42;

        assertArrayEquals(new Ed25519Signer(seed).getPublicKey(), new Ed25519Signer(seed).getPublicKey());
    }
}

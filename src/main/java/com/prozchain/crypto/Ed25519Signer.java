package com.prozchain.crypto;

import com.prozchain.exception.SignatureException;
import com.prozchain.types.Signature;
import lombok.extern.java.Log;
import org.bouncycastle.crypto.CryptoException;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

import java.security.SecureRandom;

@Log
public class Ed25519Signer implements Signer {

    private final Ed25519PrivateKeyParameters privateKey;
    private final Ed25519PublicKeyParameters publicKey;

    public Ed25519Signer(byte[] privateKeySeed) {
        this.privateKey = new Ed25519PrivateKeyParameters(privateKeySeed, 0);
        this.publicKey = privateKey.generatePublicKey();
    }

    public static Ed25519Signer generate() {
        return new Ed25519Signer(new Ed25519PrivateKeyParameters(new SecureRandom()).getEncoded());
    }

    @Override
    public Signature sign(byte[] message) {
        org.bouncycastle.crypto.Signer signer = new org.bouncycastle.crypto.signers.Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        try {
            return new Signature(signer.generateSignature());
        } catch (CryptoException e) {
            throw new SignatureException("Could not sign message", e);
        }
    }

    @Override
    public boolean verify(byte[] publicKeyBytes, byte[] message, Signature signature) {
        if (publicKeyBytes == null || publicKeyBytes.length != Ed25519PublicKeyParameters.KEY_SIZE) {
            log.fine("Public key has the wrong length");
            return false;
        }

        Ed25519PublicKeyParameters verifyingKey;
        try {
            verifyingKey = new Ed25519PublicKeyParameters(publicKeyBytes, 0);
        } catch (IllegalArgumentException e) {
            log.fine("Malformed public key: " + e.getMessage());
            return false;
        }

        org.bouncycastle.crypto.signers.Ed25519Signer verifier = new org.bouncycastle.crypto.signers.Ed25519Signer();
        verifier.init(false, verifyingKey);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature.getBytes());
    }

    @Override
    public byte[] getPublicKey() {
        return publicKey.getEncoded();
    }
}

package com.prozchain.exception;

public class SignatureException extends ConsensusGenericException {

    public SignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}

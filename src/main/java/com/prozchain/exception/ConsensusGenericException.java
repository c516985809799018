package com.prozchain.exception;

public class ConsensusGenericException extends RuntimeException {

    public ConsensusGenericException(String message) {
        super(message);
    }

    public ConsensusGenericException(String message, Throwable cause) {
        super(message, cause);
    }
}

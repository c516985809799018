package com.prozchain.exception;

public class ValidatorSetException extends ConsensusGenericException {

    public ValidatorSetException(String message) {
        super(message);
    }
}

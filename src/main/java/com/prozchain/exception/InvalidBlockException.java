package com.prozchain.exception;

/**
 * Raised by a block executor when a proposed block fails validation. Leads to a nil prevote.
 */
public class InvalidBlockException extends ConsensusGenericException {

    public InvalidBlockException(String message) {
        super(message);
    }
}

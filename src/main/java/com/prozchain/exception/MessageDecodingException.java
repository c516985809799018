package com.prozchain.exception;

public class MessageDecodingException extends ConsensusGenericException {

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

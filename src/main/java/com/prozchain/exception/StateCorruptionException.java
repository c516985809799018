package com.prozchain.exception;

/**
 * Local consensus state went backwards (height or round regression). The node must halt and
 * wait for an operator; this exception is never recovered from.
 */
public class StateCorruptionException extends ConsensusGenericException {

    public StateCorruptionException(String message) {
        super(message);
    }
}

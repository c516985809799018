package com.prozchain.consensus.fault;

/**
 * Receives misbehaviour evidence. Penalties are decided outside consensus.
 */
public interface SlashingModule {

    void submitEvidence(Evidence evidence);
}

package com.prozchain.consensus.fault;

public enum EvidenceKind {
    EQUIVOCATION,
    DOUBLE_PROPOSAL,
    DOWNTIME
}

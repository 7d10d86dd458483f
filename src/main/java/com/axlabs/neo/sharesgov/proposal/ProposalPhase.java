package com.axlabs.neo.sharesgov.proposal;

/**
 * The lifecycle phases of a proposal. {@link #FINALIZED} is stored. The other phases are derived from the current
 * time: {@link #VOTING_OPEN} from the voting start until the deadline, {@link #CLOSED} after the deadline and
 * {@link #CREATED} before voting starts, including while a voting start is scheduled.
 */
public enum ProposalPhase {
    CREATED,
    VOTING_OPEN,
    CLOSED,
    FINALIZED
}

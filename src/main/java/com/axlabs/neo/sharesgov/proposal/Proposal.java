package com.axlabs.neo.sharesgov.proposal;

/**
 * The mutable part of a proposal, changed only by lifecycle transitions.
 * <p>
 * Information that is fixed at creation lives in {@link ProposalData}.
 */
public class Proposal {

    /**
     * The proposal's ID. IDs are assigned incrementally.
     */
    public final int id;

    /**
     * The deadline of the voting window, inclusive.
     */
    public final long deadline;

    /**
     * The start of the voting window, inclusive. Zero as long as voting was not opened.
     */
    public long votingStart;

    /**
     * Tells if this proposal was finalized. Never reverts to false.
     */
    public boolean finalized;

    /**
     * The vote counts frozen at finalization, one per option slot. Null before finalization.
     */
    public long[] finalCounts;

    public Proposal(int id, long deadline) {
        this.id = id;
        this.deadline = deadline;
        votingStart = 0;
        finalized = false;
        finalCounts = null;
    }

    public boolean isVotingOpened() {
        return votingStart != 0;
    }
}

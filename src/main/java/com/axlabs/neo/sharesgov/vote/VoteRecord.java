package com.axlabs.neo.sharesgov.vote;

import io.neow3j.types.Hash160;

/**
 * A single cast vote. Immutable.
 */
public class VoteRecord {

    private final int proposalId;
    private final Hash160 voter;
    private final Object choice;
    private final int slot;
    private final long weight;
    private final long castAt;

    /**
     * @param proposalId The proposal voted on.
     * @param voter      The voter.
     * @param choice     A {@link Boolean} on binary proposals, the option name on multi-option proposals.
     * @param slot       The counter slot the vote went to.
     * @param weight     The weight the vote was counted with.
     * @param castAt     The time of the vote.
     */
    public VoteRecord(int proposalId, Hash160 voter, Object choice, int slot, long weight, long castAt) {
        this.proposalId = proposalId;
        this.voter = voter;
        this.choice = choice;
        this.slot = slot;
        this.weight = weight;
        this.castAt = castAt;
    }

    public int getProposalId() {
        return proposalId;
    }

    public Hash160 getVoter() {
        return voter;
    }

    public Object getChoice() {
        return choice;
    }

    public int getSlot() {
        return slot;
    }

    public long getWeight() {
        return weight;
    }

    public long getCastAt() {
        return castAt;
    }
}

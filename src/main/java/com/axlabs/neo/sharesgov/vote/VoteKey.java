package com.axlabs.neo.sharesgov.vote;

import io.neow3j.types.Hash160;

import java.util.Objects;

/**
 * Composite key of a vote: the proposal and the voter.
 */
final class VoteKey {

    private final int proposalId;
    private final Hash160 voter;

    VoteKey(int proposalId, Hash160 voter) {
        this.proposalId = proposalId;
        this.voter = voter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VoteKey)) return false;
        VoteKey other = (VoteKey) o;
        return proposalId == other.proposalId && voter.equals(other.voter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId, voter);
    }
}

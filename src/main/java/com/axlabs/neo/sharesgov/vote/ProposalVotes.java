package com.axlabs.neo.sharesgov.vote;

/**
 * The running vote counters of one proposal. Binary proposals count yes in slot 0 and no in slot 1, multi-option
 * proposals have one slot per declared option.
 */
public class ProposalVotes {

    /**
     * The summed vote weight per slot.
     */
    final long[] counts;

    /**
     * The number of voters that voted on the proposal.
     */
    long voters;

    ProposalVotes(int slots) {
        counts = new long[slots];
        voters = 0;
    }

    public long getCount(int slot) {
        return counts[slot];
    }

    public long[] getCounts() {
        return counts.clone();
    }

    public long getVoters() {
        return voters;
    }

    /**
     * @return the summed weight of all cast votes.
     */
    public long getTotal() {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        return total;
    }
}

package com.axlabs.neo.sharesgov.proposal;

/**
 * The yes and no counts of a proposal and whether they are final.
 */
public class VotingHistory {

    private final long yes;
    private final long no;
    private final boolean finalized;

    public VotingHistory(long yes, long no, boolean finalized) {
        this.yes = yes;
        this.no = no;
        this.finalized = finalized;
    }

    public long getYes() {
        return yes;
    }

    public long getNo() {
        return no;
    }

    public boolean isFinalized() {
        return finalized;
    }

    @Override
    public String toString() {
        return "VotingHistory{yes=" + yes + ", no=" + no + ", finalized=" + finalized + "}";
    }
}

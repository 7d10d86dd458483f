package com.axlabs.neo.sharesgov.proposal;

import io.neow3j.types.Hash160;

import java.util.List;

/**
 * Used to return all proposal information as one structure in getter methods. Changing it has no effect on the
 * engine.
 */
public class ProposalDTO {

    public int id;
    public Hash160 creator;
    public String description;
    public List<String> options;
    public long createdAt;
    public long votingStart;
    public long deadline;
    public int shareClass;
    public VotingWeight weighting;
    public long votingBase;
    public int linkedFraction;
    public boolean finalized;
    public ProposalPhase phase;
    public long voterCount;

    public ProposalDTO() {
    }
}

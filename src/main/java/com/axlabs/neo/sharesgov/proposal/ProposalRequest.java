package com.axlabs.neo.sharesgov.proposal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Collects the parameters of a new proposal.
 * <p>
 * Without options the proposal is a binary yes/no proposal. Without an explicit voting base the base is taken from
 * the total minted amount of the share class, which then has to be set.
 */
public class ProposalRequest {

    private final String description;
    private final long deadline;
    private final List<String> options = new ArrayList<>();
    private int shareClass = ProposalData.NONE;
    private VotingWeight weighting = VotingWeight.PER_VOTER;
    private long votingBase = 0;

    public ProposalRequest(String description, long deadline) {
        this.description = description;
        this.deadline = deadline;
    }

    public ProposalRequest options(String... options) {
        this.options.addAll(Arrays.asList(options));
        return this;
    }

    public ProposalRequest options(List<String> options) {
        this.options.addAll(options);
        return this;
    }

    public ProposalRequest shareClass(int shareClass) {
        this.shareClass = shareClass;
        return this;
    }

    public ProposalRequest weighting(VotingWeight weighting) {
        this.weighting = weighting;
        return this;
    }

    public ProposalRequest votingBase(long votingBase) {
        this.votingBase = votingBase;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public long getDeadline() {
        return deadline;
    }

    public List<String> getOptions() {
        return new ArrayList<>(options);
    }

    public int getShareClass() {
        return shareClass;
    }

    public VotingWeight getWeighting() {
        return weighting;
    }

    public long getVotingBase() {
        return votingBase;
    }
}

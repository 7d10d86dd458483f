package com.axlabs.neo.sharesgov.tally;

/**
 * The outcome of applying a {@link GovernanceModel} to the votes of a proposal.
 */
public class Decision {

    private final boolean passed;
    private final GovernanceModel model;
    private final long affirmative;
    private final long negative;
    private final long totalVotes;
    private final long votingBase;
    private final String winningOption;

    public Decision(boolean passed, GovernanceModel model, long affirmative, long negative, long totalVotes,
            long votingBase, String winningOption) {
        this.passed = passed;
        this.model = model;
        this.affirmative = affirmative;
        this.negative = negative;
        this.totalVotes = totalVotes;
        this.votingBase = votingBase;
        this.winningOption = winningOption;
    }

    public boolean isPassed() {
        return passed;
    }

    public GovernanceModel getModel() {
        return model;
    }

    /**
     * @return the yes weight on binary proposals, the weight of the leading option on multi-option proposals.
     */
    public long getAffirmative() {
        return affirmative;
    }

    /**
     * @return the no weight on binary proposals, the weight of all other options on multi-option proposals.
     */
    public long getNegative() {
        return negative;
    }

    public long getTotalVotes() {
        return totalVotes;
    }

    public long getVotingBase() {
        return votingBase;
    }

    /**
     * @return the single leading option of a multi-option proposal. Null on binary proposals and on ties.
     */
    public String getWinningOption() {
        return winningOption;
    }

    @Override
    public String toString() {
        return "Decision{" + model + ", passed=" + passed + ", affirmative=" + affirmative + ", negative=" +
                negative + ", base=" + votingBase + (winningOption == null ? "" : ", winner=" + winningOption) + "}";
    }
}

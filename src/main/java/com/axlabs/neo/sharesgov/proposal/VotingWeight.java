package com.axlabs.neo.sharesgov.proposal;

/**
 * How much a single vote counts towards the tally.
 */
public enum VotingWeight {

    /**
     * Every voter counts once.
     */
    PER_VOTER,

    /**
     * A voter counts with the shares of the proposal's share class it holds at the time of voting, locked shares
     * included.
     */
    BALANCE
}

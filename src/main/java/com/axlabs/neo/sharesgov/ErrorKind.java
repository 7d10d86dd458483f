package com.axlabs.neo.sharesgov;

/**
 * The kinds of failures reported by {@link SharesGov}. Every failure is a local validation failure detected before
 * any state is changed. None of them is transient, i.e., retrying the same call against the same state fails again.
 */
public enum ErrorKind {

    NOT_FOUND("Not found"),
    INVALID_DEADLINE("Invalid deadline"),
    INVALID_WINDOW("Invalid voting window"),
    INVALID_PROPOSAL("Invalid proposal"),
    INVALID_ARGUMENT("Invalid argument"),
    VOTING_NOT_STARTED("Voting not started"),
    VOTING_CLOSED("Voting closed"),
    ALREADY_VOTED("Already voted on this proposal"),
    NO_VOTING_WEIGHT("No voting weight"),
    INVALID_OPTION("Invalid option"),
    TOO_EARLY("Too early"),
    ALREADY_FINALIZED("Proposal already finalized"),
    INSUFFICIENT_BALANCE("Insufficient balance"),
    INSUFFICIENT_LOCKED("Insufficient locked balance"),
    NOT_AUTHORIZED("Not authorised"),
    PAUSED("Engine is paused");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

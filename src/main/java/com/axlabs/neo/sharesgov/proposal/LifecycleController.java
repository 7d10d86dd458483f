package com.axlabs.neo.sharesgov.proposal;

import com.axlabs.neo.sharesgov.ErrorKind;
import com.axlabs.neo.sharesgov.GovernanceException;

/**
 * Enforces the phase order {@code CREATED -> VOTING_OPEN -> CLOSED -> FINALIZED} and applies the stored transitions.
 * <p>
 * A proposal cannot be withdrawn. Withdrawal would need its own phase returned by {@link #phaseOf} and a check in
 * {@link #checkVotingWindow} and {@link #checkFinalizable} that rejects withdrawn proposals.
 */
public class LifecycleController {

    /**
     * @param proposal The proposal.
     * @param now      The current time.
     * @return the phase the proposal is in at {@code now}.
     */
    public ProposalPhase phaseOf(Proposal proposal, long now) {
        if (proposal.finalized) {
            return ProposalPhase.FINALIZED;
        }
        if (now > proposal.deadline) {
            return ProposalPhase.CLOSED;
        }
        if (proposal.isVotingOpened() && now >= proposal.votingStart) {
            return ProposalPhase.VOTING_OPEN;
        }
        return ProposalPhase.CREATED;
    }

    /**
     * Checks that a deadline lies strictly after {@code now}.
     */
    public void checkDeadline(long deadline, long now, String method) {
        if (deadline <= now) {
            throw new GovernanceException(ErrorKind.INVALID_DEADLINE, method, "Deadline not in the future");
        }
    }

    public void checkOpenable(Proposal proposal, long votingStart, String method) {
        if (proposal.isVotingOpened()) {
            throw new GovernanceException(ErrorKind.INVALID_WINDOW, method, "Voting already opened");
        }
        if (votingStart <= 0 || votingStart >= proposal.deadline) {
            throw new GovernanceException(ErrorKind.INVALID_WINDOW, method, "Voting start not before deadline");
        }
    }

    public void open(Proposal proposal, long votingStart) {
        proposal.votingStart = votingStart;
    }

    /**
     * Checks that votes are accepted at {@code now}, i.e., voting was opened, {@code now} lies in
     * {@code [votingStart, deadline]} and the proposal is not finalized.
     */
    public void checkVotingWindow(Proposal proposal, long now, String method) {
        if (!proposal.isVotingOpened()) {
            throw new GovernanceException(ErrorKind.VOTING_NOT_STARTED, method);
        }
        if (proposal.finalized || now < proposal.votingStart || now > proposal.deadline) {
            throw new GovernanceException(ErrorKind.VOTING_CLOSED, method);
        }
    }

    public void checkFinalizable(Proposal proposal, long now, String method) {
        if (now <= proposal.deadline) {
            throw new GovernanceException(ErrorKind.TOO_EARLY, method, "Voting deadline not passed");
        }
        if (proposal.finalized) {
            throw new GovernanceException(ErrorKind.ALREADY_FINALIZED, method);
        }
    }

    /**
     * Marks the proposal finalized and freezes the given counts.
     */
    public void markFinalized(Proposal proposal, long[] counts) {
        proposal.finalCounts = counts.clone();
        proposal.finalized = true;
    }
}

package com.axlabs.neo.sharesgov.vote;

import io.neow3j.types.Hash160;

import java.util.HashMap;
import java.util.Map;

/**
 * Records at most one vote per proposal and voter and keeps the per-proposal counters in step with the records.
 * <p>
 * Votes live in one flat map keyed by (proposal, voter). Counters are updated when a vote is recorded, so reading a
 * tally never iterates over votes.
 */
public class VoteLedger {

    private final Map<VoteKey, VoteRecord> votes = new HashMap<>();
    private final Map<Integer, ProposalVotes> proposalVotes = new HashMap<>(); // [int id: ProposalVotes counters]

    /**
     * Sets up the counters of a new proposal.
     *
     * @param proposalId The proposal id.
     * @param slots      The number of counter slots.
     */
    public void register(int proposalId, int slots) {
        if (proposalVotes.containsKey(proposalId)) {
            throw new IllegalStateException("Counters of proposal " + proposalId + " already exist");
        }
        proposalVotes.put(proposalId, new ProposalVotes(slots));
    }

    public boolean hasVoted(int proposalId, Hash160 voter) {
        return votes.containsKey(new VoteKey(proposalId, voter));
    }

    /**
     * @return the vote of {@code voter} on the proposal or null if there is none.
     */
    public VoteRecord get(int proposalId, Hash160 voter) {
        return votes.get(new VoteKey(proposalId, voter));
    }

    /**
     * @return the counters of the proposal or null if the proposal is unknown.
     */
    public ProposalVotes votesOf(int proposalId) {
        return proposalVotes.get(proposalId);
    }

    /**
     * Inserts the vote and adds its weight to its slot. Both happen or neither does.
     *
     * @param vote The vote to record.
     */
    public void record(VoteRecord vote) {
        ProposalVotes pv = proposalVotes.get(vote.getProposalId());
        if (pv == null) {
            throw new IllegalStateException("No counters for proposal " + vote.getProposalId());
        }
        if (vote.getSlot() < 0 || vote.getSlot() >= pv.counts.length) {
            throw new IllegalArgumentException("Slot " + vote.getSlot() + " out of range");
        }
        long updated = Math.addExact(pv.counts[vote.getSlot()], vote.getWeight());
        VoteKey key = new VoteKey(vote.getProposalId(), vote.getVoter());
        if (votes.putIfAbsent(key, vote) != null) {
            throw new IllegalStateException("Voter already recorded on proposal " + vote.getProposalId());
        }
        pv.counts[vote.getSlot()] = updated;
        pv.voters += 1;
    }
}

package com.axlabs.neo.sharesgov.proposal;

import java.util.HashMap;
import java.util.Map;

/**
 * Append-only storage of proposals. IDs start at 0 and are never reused.
 */
public class ProposalStore {

    private final Map<Integer, Proposal> proposals = new HashMap<>(); // [int id: Proposal proposal]
    private final Map<Integer, ProposalData> proposalData = new HashMap<>(); // [int id: ProposalData data]
    private int proposalCount = 0;

    /**
     * Stores a new proposal under the next id.
     *
     * @param data     The creation data.
     * @param deadline The deadline of the voting window.
     * @return the new proposal.
     */
    public Proposal add(ProposalData data, long deadline) {
        int id = proposalCount;
        Proposal proposal = new Proposal(id, deadline);
        proposals.put(id, proposal);
        proposalData.put(id, data);
        proposalCount = id + 1;
        return proposal;
    }

    /**
     * @param id The proposal id.
     * @return the proposal or null if it doesn't exist.
     */
    public Proposal get(int id) {
        return proposals.get(id);
    }

    /**
     * @param id The proposal id.
     * @return the creation data or null if the proposal doesn't exist.
     */
    public ProposalData getData(int id) {
        return proposalData.get(id);
    }

    public int count() {
        return proposalCount;
    }
}

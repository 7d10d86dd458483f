package com.axlabs.neo.sharesgov.proposal;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.List;

/**
 * Proposal information that is set at the time of creation of a proposal and doesn't change after that.
 */
public class ProposalData {

    /**
     * Used for {@link #shareClass} and {@link #linkedFraction} when there is none.
     */
    public static final int NONE = -1;

    public static final String YES = "yes";
    public static final String NO = "no";

    /**
     * The creator of the proposal.
     */
    public final Hash160 creator;

    public final String description;

    /**
     * The declared options of a multi-option proposal in declaration order. Empty for binary proposals.
     */
    public final List<String> options;

    public final long createdAt;

    /**
     * The share class that decides voting eligibility and weight, or {@link #NONE}.
     */
    public final int shareClass;

    public final VotingWeight weighting;

    /**
     * The denominator of every decision on this proposal. Captured at creation and never recomputed.
     */
    public final long votingBase;

    /**
     * The fraction this proposal votes on, or {@link #NONE}.
     */
    public final int linkedFraction;

    public ProposalData(Hash160 creator, String description, List<String> options, long createdAt, int shareClass,
            VotingWeight weighting, long votingBase, int linkedFraction) {
        this.creator = creator;
        this.description = description;
        this.options = options == null ? Collections.emptyList() : Collections.unmodifiableList(options);
        this.createdAt = createdAt;
        this.shareClass = shareClass;
        this.weighting = weighting;
        this.votingBase = votingBase;
        this.linkedFraction = linkedFraction;
    }

    public boolean isBinary() {
        return options.isEmpty();
    }

    /**
     * @return the number of vote counters the proposal needs. Binary proposals use slot 0 for yes and 1 for no.
     */
    public int slotCount() {
        return isBinary() ? 2 : options.size();
    }

    /**
     * @param option An option name.
     * @return the counter slot of the option or -1 if the proposal doesn't declare it.
     */
    public int slotOf(String option) {
        if (option == null) {
            return -1;
        }
        if (isBinary()) {
            if (YES.equals(option)) return 0;
            if (NO.equals(option)) return 1;
            return -1;
        }
        return options.indexOf(option);
    }

    /**
     * @param slot A counter slot.
     * @return the option name of the slot.
     */
    public String optionAt(int slot) {
        if (isBinary()) {
            return slot == 0 ? YES : NO;
        }
        return options.get(slot);
    }
}

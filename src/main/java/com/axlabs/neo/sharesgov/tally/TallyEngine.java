package com.axlabs.neo.sharesgov.tally;

import com.axlabs.neo.sharesgov.proposal.ProposalData;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the counters of a proposal into results and decisions. Stateless.
 */
public class TallyEngine {

    /**
     * Applies {@code model} to the counts. On binary proposals the yes count is affirmative. On multi-option
     * proposals the single leading option is; a tie for the lead fails.
     *
     * @param data   The proposal's creation data, providing the kind and the voting base.
     * @param counts The counts per slot.
     * @param model  The decision rule.
     * @return the decision.
     */
    public Decision decide(ProposalData data, long[] counts, GovernanceModel model) {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        if (data.isBinary()) {
            long yes = counts[0];
            return new Decision(model.passes(yes, data.votingBase), model, yes, counts[1], total, data.votingBase,
                    null);
        }
        int lead = -1;
        boolean tied = false;
        for (int i = 0; i < counts.length; i++) {
            if (lead < 0 || counts[i] > counts[lead]) {
                lead = i;
                tied = false;
            } else if (counts[i] == counts[lead]) {
                tied = true;
            }
        }
        long affirmative = counts[lead];
        if (tied) {
            return new Decision(false, model, affirmative, total - affirmative, total, data.votingBase, null);
        }
        return new Decision(model.passes(affirmative, data.votingBase), model, affirmative, total - affirmative,
                total, data.votingBase, data.optionAt(lead));
    }

    /**
     * @return the count of every option in declaration order. Binary proposals report {@code yes} and {@code no}.
     */
    public List<OptionResult> results(ProposalData data, long[] counts) {
        List<OptionResult> results = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            results.add(new OptionResult(data.optionAt(i), counts[i]));
        }
        return results;
    }
}

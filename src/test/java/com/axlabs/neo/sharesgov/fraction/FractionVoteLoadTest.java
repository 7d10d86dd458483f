package com.axlabs.neo.sharesgov.fraction;

import com.axlabs.neo.sharesgov.SharesGov;
import com.axlabs.neo.sharesgov.tally.Decision;
import com.axlabs.neo.sharesgov.tally.GovernanceModel;
import com.axlabs.neo.sharesgov.util.TestClock;
import com.axlabs.neo.sharesgov.util.TestLedger;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.Test;

import static com.axlabs.neo.sharesgov.util.TestHelper.PHASE_LENGTH;
import static com.axlabs.neo.sharesgov.util.TestHelper.START;
import static com.axlabs.neo.sharesgov.util.TestHelper.alice;
import static com.axlabs.neo.sharesgov.util.TestHelper.newGov;
import static com.axlabs.neo.sharesgov.util.TestHelper.voter;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

/**
 * Fraction votes with a base of one million shares where every voter holds exactly one share.
 */
public class FractionVoteLoadTest {

    private static final long SUPPLY = 1_000_000;

    private static Decision voteWithSingleShareHolders(int yesVoters) {
        TestLedger ledger = new TestLedger();
        TestClock clock = new TestClock(START);
        SharesGov gov = newGov(ledger, clock);
        // Identities from 1 upwards are the holders, so the owner gets another prefix.
        Hash160 owner = alice();
        int fractionId = gov.createFraction(alice(), "asset:load", owner, SUPPLY);
        int proposalId = gov.createFractionVote(alice(), fractionId, "load", START + PHASE_LENGTH);
        gov.openVoting(alice(), proposalId, START);

        for (int i = 1; i <= yesVoters; i++) {
            Hash160 holder = voter(i);
            ledger.transfer(owner, holder, fractionId, 1);
            gov.castVote(proposalId, holder, true);
        }
        assertThat(gov.getVotes(proposalId, "yes"), is((long) yesVoters));
        return gov.calculateDecision(fractionId, GovernanceModel.SIMPLE_MAJORITY);
    }

    @Test
    public void pass_with_600001_single_share_voters() {
        Decision d = voteWithSingleShareHolders(600_001);
        assertThat(d.isPassed(), is(true));
        assertThat(d.getAffirmative(), is(600_001L));
        assertThat(d.getVotingBase(), is(SUPPLY));
    }

    @Test
    public void fail_with_half_of_the_supply() {
        Decision d = voteWithSingleShareHolders(500_000);
        assertThat(d.isPassed(), is(false));
        assertThat(d.getAffirmative(), is(500_000L));
    }

    @Test
    public void pass_with_one_vote_over_half_of_the_supply() {
        assertThat(voteWithSingleShareHolders(500_001).isPassed(), is(true));
    }
}

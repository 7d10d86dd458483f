package com.axlabs.neo.sharesgov.fraction;

import com.axlabs.neo.sharesgov.ErrorKind;
import com.axlabs.neo.sharesgov.SharesGov;
import com.axlabs.neo.sharesgov.event.Notification;
import com.axlabs.neo.sharesgov.proposal.ProposalDTO;
import com.axlabs.neo.sharesgov.proposal.VotingWeight;
import com.axlabs.neo.sharesgov.tally.Decision;
import com.axlabs.neo.sharesgov.tally.GovernanceModel;
import com.axlabs.neo.sharesgov.util.TestClock;
import com.axlabs.neo.sharesgov.util.TestLedger;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.axlabs.neo.sharesgov.SharesGov.FRACTION_CREATED;
import static com.axlabs.neo.sharesgov.util.TestHelper.PHASE_LENGTH;
import static com.axlabs.neo.sharesgov.util.TestHelper.START;
import static com.axlabs.neo.sharesgov.util.TestHelper.alice;
import static com.axlabs.neo.sharesgov.util.TestHelper.assertGovernanceError;
import static com.axlabs.neo.sharesgov.util.TestHelper.newGov;
import static com.axlabs.neo.sharesgov.util.TestHelper.voter;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

public class FractionVoteTest {

    private static final String ASSET = "asset:harbour-warehouse";

    private TestLedger ledger;
    private TestClock clock;
    private SharesGov gov;
    private Hash160 owner;

    @BeforeEach
    public void setUp() {
        ledger = new TestLedger();
        clock = new TestClock(START);
        gov = newGov(ledger, clock);
        owner = voter(0);
    }

    @Test
    public void succeed_creating_fraction() {
        int id = gov.createFraction(alice(), ASSET, owner, 100);

        Fraction f = gov.getFraction(id);
        assertThat(f.getId(), is(0));
        assertThat(f.getShareClass(), is(0));
        assertThat(f.getAssetId(), is(ASSET));
        assertThat(f.getOwner(), is(owner));
        assertThat(f.getAmount(), is(100L));
        assertThat(f.getCreatedAt(), is(START));
        assertThat(gov.getFractionCount(), is(1));
        assertThat(ledger.balanceOf(owner, f.getShareClass()), is(100L));
        assertThat(ledger.totalMinted(f.getShareClass()), is(100L));

        Notification ntf = gov.getNotifications(FRACTION_CREATED).get(0);
        assertThat(ntf.getState().get(0), is(id));
        assertThat(ntf.getState().get(1), is(ASSET));
        assertThat(ntf.getState().get(2), is(100L));
    }

    @Test
    public void use_separate_share_class_per_fraction() {
        int first = gov.createFraction(alice(), ASSET, owner, 10);
        int second = gov.createFraction(alice(), "asset:other", owner, 20);
        assertThat(second, is(first + 1));
        assertThat(ledger.balanceOf(owner, first), is(10L));
        assertThat(ledger.balanceOf(owner, second), is(20L));
    }

    @Test
    public void fail_creating_invalid_fraction() {
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Missing asset id",
                () -> gov.createFraction(alice(), " ", owner, 10));
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Missing owner",
                () -> gov.createFraction(alice(), ASSET, null, 10));
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Amount not positive",
                () -> gov.createFraction(alice(), ASSET, owner, 0));
        assertGovernanceError(ErrorKind.NOT_AUTHORIZED,
                () -> gov.createFraction(voter(5), ASSET, owner, 10));
        assertThat(gov.getFractionCount(), is(0));
        assertThat(ledger.totalMinted(0), is(0L));
    }

    @Test
    public void fail_getting_unknown_fraction() {
        assertGovernanceError(ErrorKind.NOT_FOUND, "Fraction doesn't exist", () -> gov.getFraction(0));
        assertGovernanceError(ErrorKind.NOT_FOUND,
                () -> gov.createFractionVote(alice(), 3, "vote", START + PHASE_LENGTH));
    }

    @Test
    public void create_balance_weighted_vote_on_fraction() {
        int fractionId = gov.createFraction(alice(), ASSET, owner, 100);
        int proposalId = gov.createFractionVote(alice(), fractionId, "Sell the warehouse", START + PHASE_LENGTH);

        ProposalDTO p = gov.getProposal(proposalId);
        assertThat(p.shareClass, is(fractionId));
        assertThat(p.weighting, is(VotingWeight.BALANCE));
        assertThat(p.votingBase, is(100L));
        assertThat(p.linkedFraction, is(fractionId));
    }

    @Test
    public void calculate_decision_of_latest_fraction_vote() {
        int fractionId = gov.createFraction(alice(), ASSET, owner, 100);
        ledger.transfer(owner, voter(1), fractionId, 40);

        int first = gov.createFractionVote(alice(), fractionId, "first", START + PHASE_LENGTH);
        gov.openVoting(alice(), first, START);
        gov.castVote(first, owner, true);
        assertThat(gov.calculateDecision(fractionId, GovernanceModel.SIMPLE_MAJORITY).isPassed(), is(true));

        int second = gov.createFractionVote(alice(), fractionId, "second", START + PHASE_LENGTH);
        gov.openVoting(alice(), second, START);
        gov.castVote(second, voter(1), true);
        gov.castVote(second, owner, false);

        Decision d = gov.calculateDecision(fractionId, GovernanceModel.SIMPLE_MAJORITY);
        assertThat(d.isPassed(), is(false));
        assertThat(d.getAffirmative(), is(40L));
        assertThat(d.getNegative(), is(60L));
        assertThat(d.getVotingBase(), is(100L));
    }

    @Test
    public void fail_calculating_decision_without_vote() {
        int fractionId = gov.createFraction(alice(), ASSET, owner, 100);
        assertGovernanceError(ErrorKind.NOT_FOUND, "No vote on fraction",
                () -> gov.calculateDecision(fractionId, GovernanceModel.CONSENSUS));
        assertGovernanceError(ErrorKind.NOT_FOUND, "Fraction doesn't exist",
                () -> gov.calculateDecision(fractionId + 1, GovernanceModel.CONSENSUS));
    }

    @Test
    public void keep_voting_base_when_more_shares_are_minted() {
        int fractionId = gov.createFraction(alice(), ASSET, owner, 100);
        int proposalId = gov.createFractionVote(alice(), fractionId, "fixed base", START + PHASE_LENGTH);
        ledger.mint(voter(1), fractionId, 900);
        assertThat(gov.getProposal(proposalId).votingBase, is(100L));
    }
}

package com.axlabs.neo.sharesgov;

import com.axlabs.neo.sharesgov.event.Notification;
import com.axlabs.neo.sharesgov.util.TestClock;
import com.axlabs.neo.sharesgov.util.TestLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.axlabs.neo.sharesgov.GovernanceParameters.EVENT_HISTORY_KEY;
import static com.axlabs.neo.sharesgov.GovernanceParameters.MAX_OPTIONS_KEY;
import static com.axlabs.neo.sharesgov.GovernanceParameters.MAX_PAGE_SIZE_KEY;
import static com.axlabs.neo.sharesgov.SharesGov.PARAMETER_CHANGED;
import static com.axlabs.neo.sharesgov.SharesGov.PAUSED;
import static com.axlabs.neo.sharesgov.SharesGov.UNPAUSED;
import static com.axlabs.neo.sharesgov.util.TestHelper.PHASE_LENGTH;
import static com.axlabs.neo.sharesgov.util.TestHelper.START;
import static com.axlabs.neo.sharesgov.util.TestHelper.alice;
import static com.axlabs.neo.sharesgov.util.TestHelper.assertGovernanceError;
import static com.axlabs.neo.sharesgov.util.TestHelper.bob;
import static com.axlabs.neo.sharesgov.util.TestHelper.createAndOpenProposal;
import static com.axlabs.neo.sharesgov.util.TestHelper.newGov;
import static com.axlabs.neo.sharesgov.util.TestHelper.voter;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;

public class GovernanceParametersTest {

    private TestClock clock;
    private SharesGov gov;

    @BeforeEach
    public void setUp() {
        clock = new TestClock(START);
        gov = newGov(new TestLedger(), clock);
    }

    @Test
    public void have_default_values() {
        assertThat(gov.getParameter(MAX_OPTIONS_KEY), is(16));
        assertThat(gov.getParameter(MAX_PAGE_SIZE_KEY), is(100));
        assertThat(gov.getParameter(EVENT_HISTORY_KEY), is(10_000));
        assertThat(gov.getParameters().size(), is(3));
        assertGovernanceError(ErrorKind.NOT_FOUND, "Unknown parameter", () -> gov.getParameter("voting_time"));
    }

    @Test
    public void succeed_changing_parameter() {
        gov.changeParam(alice(), MAX_OPTIONS_KEY, 2);
        assertThat(gov.getParameter(MAX_OPTIONS_KEY), is(2));
        assertGovernanceError(ErrorKind.INVALID_PROPOSAL, "Too many options",
                () -> gov.createProposal(alice(), "three", Arrays.asList("a", "b", "c"), START + PHASE_LENGTH, 1));

        Notification ntf = gov.getNotifications(PARAMETER_CHANGED).get(0);
        assertThat(ntf.getState().get(0), is(MAX_OPTIONS_KEY));
        assertThat(ntf.getState().get(1), is(2));
    }

    @Test
    public void fail_changing_parameter_to_invalid_value() {
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "[SharesGov.changeParam] Invalid parameter value",
                () -> gov.changeParam(alice(), MAX_OPTIONS_KEY, 1));
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Invalid parameter value",
                () -> gov.changeParam(alice(), MAX_PAGE_SIZE_KEY, 0));
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Invalid parameter value",
                () -> gov.changeParam(alice(), EVENT_HISTORY_KEY, -1));
        assertGovernanceError(ErrorKind.INVALID_ARGUMENT, "Unknown parameter",
                () -> gov.changeParam(alice(), "quorum", 5));
        assertThat(gov.getParameter(MAX_OPTIONS_KEY), is(16));
    }

    @Test
    public void fail_changing_parameter_without_authorization() {
        assertGovernanceError(ErrorKind.NOT_AUTHORIZED, () -> gov.changeParam(voter(1), MAX_PAGE_SIZE_KEY, 5));
        assertThat(gov.getParameter(MAX_PAGE_SIZE_KEY), is(100));
    }

    @Test
    public void shrink_event_history() {
        gov.createProposal(alice(), "one", null, START + PHASE_LENGTH, 1);
        gov.createProposal(alice(), "two", null, START + PHASE_LENGTH, 1);
        gov.changeParam(bob(), EVENT_HISTORY_KEY, 1);
        // Only the ParameterChanged notification is retained.
        assertThat(gov.getNotifications(), hasSize(1));
        assertThat(gov.getNotifications().get(0).getEventName(), is(PARAMETER_CHANGED));
    }

    @Test
    public void reject_mutations_while_paused() {
        int id = createAndOpenProposal(gov, clock, "paused", 3);
        gov.pause(alice());
        assertThat(gov.isPaused(), is(true));

        assertGovernanceError(ErrorKind.PAUSED, "[SharesGov.vote] Engine is paused",
                () -> gov.castVote(id, voter(1), true));
        assertGovernanceError(ErrorKind.PAUSED,
                () -> gov.createProposal(alice(), "new", null, START + PHASE_LENGTH, 1));
        assertGovernanceError(ErrorKind.PAUSED, () -> gov.changeParam(alice(), MAX_OPTIONS_KEY, 4));
        assertGovernanceError(ErrorKind.PAUSED, () -> gov.lockTokens(voter(1), 0, 1, START + 1));
        // Reads still work.
        assertThat(gov.getProposal(id).description, is("paused"));

        gov.unpause(bob());
        assertThat(gov.isPaused(), is(false));
        gov.castVote(id, voter(1), true);
        assertThat(gov.getVotes(id, "yes"), is(1L));
        assertThat(gov.getNotifications(PAUSED), hasSize(1));
        assertThat(gov.getNotifications(UNPAUSED), hasSize(1));
    }

    @Test
    public void fail_pausing_without_authorization() {
        assertGovernanceError(ErrorKind.NOT_AUTHORIZED, "[SharesGov.pause] Not authorised",
                () -> gov.pause(voter(1)));
        gov.pause(alice());
        assertGovernanceError(ErrorKind.NOT_AUTHORIZED, () -> gov.unpause(voter(1)));
        assertThat(gov.isPaused(), is(true));
    }
}

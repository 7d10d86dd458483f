package com.axlabs.neo.sharesgov;

import com.axlabs.neo.sharesgov.event.Event;
import com.axlabs.neo.sharesgov.event.Event2Args;
import com.axlabs.neo.sharesgov.event.Event3Args;
import com.axlabs.neo.sharesgov.event.Event4Args;
import com.axlabs.neo.sharesgov.event.EventBus;
import com.axlabs.neo.sharesgov.event.EventListener;
import com.axlabs.neo.sharesgov.event.Notification;
import com.axlabs.neo.sharesgov.fraction.Fraction;
import com.axlabs.neo.sharesgov.fraction.FractionRegistry;
import com.axlabs.neo.sharesgov.ledger.AccessControl;
import com.axlabs.neo.sharesgov.ledger.OperatorAccessControl;
import com.axlabs.neo.sharesgov.ledger.ShareLedger;
import com.axlabs.neo.sharesgov.lock.LockRecord;
import com.axlabs.neo.sharesgov.lock.LockedBalances;
import com.axlabs.neo.sharesgov.proposal.LifecycleController;
import com.axlabs.neo.sharesgov.proposal.Proposal;
import com.axlabs.neo.sharesgov.proposal.ProposalDTO;
import com.axlabs.neo.sharesgov.proposal.ProposalData;
import com.axlabs.neo.sharesgov.proposal.ProposalPhase;
import com.axlabs.neo.sharesgov.proposal.ProposalRequest;
import com.axlabs.neo.sharesgov.proposal.ProposalStore;
import com.axlabs.neo.sharesgov.proposal.VotingHistory;
import com.axlabs.neo.sharesgov.proposal.VotingWeight;
import com.axlabs.neo.sharesgov.tally.Decision;
import com.axlabs.neo.sharesgov.tally.GovernanceModel;
import com.axlabs.neo.sharesgov.tally.OptionResult;
import com.axlabs.neo.sharesgov.tally.TallyEngine;
import com.axlabs.neo.sharesgov.vote.ProposalVotes;
import com.axlabs.neo.sharesgov.vote.VoteLedger;
import com.axlabs.neo.sharesgov.vote.VoteRecord;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The governance engine. Share holders vote on proposals and the engine decides them under a
 * {@link GovernanceModel}.
 * <p>
 * All methods are linearizable. Every call validates before it changes anything, so a rejected call leaves no trace
 * in the engine's state. Rejections are reported as {@link GovernanceException}s.
 * <p>
 * Listeners registered with {@link #addListener(EventListener)} are notified after the firing operation released the
 * engine's lock.
 */
public class SharesGov {

    private static final Logger log = LoggerFactory.getLogger(SharesGov.class);

    //region EVENT NAMES
    public static final String PROPOSAL_CREATED = "ProposalCreated";
    public static final String VOTING_STARTED = "VotingStarted";
    public static final String VOTE_CAST = "VoteCast";
    public static final String PROPOSAL_FINALIZED = "ProposalFinalized";
    public static final String FRACTION_CREATED = "FractionCreated";
    public static final String TOKENS_LOCKED = "TokensLocked";
    public static final String TOKENS_UNLOCKED = "TokensUnlocked";
    public static final String PARAMETER_CHANGED = "ParameterChanged";
    public static final String PAUSED = "Paused";
    public static final String UNPAUSED = "Unpaused";
    //endregion EVENT NAMES

    private final ShareLedger ledger;
    private final AccessControl accessControl;
    private final TimeSource timeSource;
    private final GovernanceParameters parameters;

    private final ProposalStore proposals = new ProposalStore();
    private final VoteLedger votes = new VoteLedger();
    private final TallyEngine tally = new TallyEngine();
    private final LifecycleController lifecycle = new LifecycleController();
    private final FractionRegistry fractions = new FractionRegistry();
    private final LockedBalances locks = new LockedBalances();
    private final EventBus bus;
    private boolean paused = false;

    //region EVENTS
    private final Event3Args<Integer, String, Long> created;
    private final Event2Args<Integer, Long> votingStarted;
    private final Event3Args<Integer, Hash160, Object> voteCast;
    private final Event3Args<Integer, Long, Long> finalized;
    private final Event3Args<Integer, String, Long> fractionCreated;
    private final Event4Args<Hash160, Integer, Long, Long> tokensLocked;
    private final Event3Args<Hash160, Integer, Long> tokensUnlocked;
    private final Event2Args<String, Integer> paramChanged;
    private final Event pausedEvent;
    private final Event unpausedEvent;
    //endregion EVENTS

    public SharesGov(ShareLedger ledger, AccessControl accessControl, TimeSource timeSource,
            GovernanceParameters parameters) {
        if (ledger == null || accessControl == null || timeSource == null || parameters == null) {
            throw new IllegalArgumentException("Ledger, access control, time source and parameters are required");
        }
        this.ledger = ledger;
        this.accessControl = accessControl;
        this.timeSource = timeSource;
        this.parameters = parameters;
        bus = new EventBus(parameters.getInt(GovernanceParameters.EVENT_HISTORY_KEY));
        created = new Event3Args<>(PROPOSAL_CREATED, bus);
        votingStarted = new Event2Args<>(VOTING_STARTED, bus);
        voteCast = new Event3Args<>(VOTE_CAST, bus);
        finalized = new Event3Args<>(PROPOSAL_FINALIZED, bus);
        fractionCreated = new Event3Args<>(FRACTION_CREATED, bus);
        tokensLocked = new Event4Args<>(TOKENS_LOCKED, bus);
        tokensUnlocked = new Event3Args<>(TOKENS_UNLOCKED, bus);
        paramChanged = new Event2Args<>(PARAMETER_CHANGED, bus);
        pausedEvent = new Event(PAUSED, bus);
        unpausedEvent = new Event(UNPAUSED, bus);
    }

    /**
     * Creates an engine whose operators and parameters are read from {@value Config#PROPS_FILE}.
     *
     * @param ledger     The share ledger.
     * @param timeSource The clock.
     * @return the engine.
     */
    public static SharesGov fromConfig(ShareLedger ledger, TimeSource timeSource) {
        return fromConfig(Config.load(), ledger, timeSource);
    }

    public static SharesGov fromConfig(Config config, ShareLedger ledger, TimeSource timeSource) {
        OperatorAccessControl operators = new OperatorAccessControl(config.getOperators());
        log.info("Starting governance engine with {} operator(s)", operators.getOperators().size());
        return new SharesGov(ledger, operators, timeSource, config.getParameters());
    }

    //region SAFE METHODS

    /**
     * Gets all information of the proposal with {@code id}.
     *
     * @param id The proposal's id.
     * @return a snapshot of the proposal.
     */
    public synchronized ProposalDTO getProposal(int id) {
        Proposal p = requireProposal(id, "getProposal");
        ProposalData data = proposals.getData(id);
        ProposalDTO dto = new ProposalDTO();
        dto.id = id;
        dto.creator = data.creator;
        dto.description = data.description;
        dto.options = new ArrayList<>(data.options);
        dto.createdAt = data.createdAt;
        dto.votingStart = p.votingStart;
        dto.deadline = p.deadline;
        dto.shareClass = data.shareClass;
        dto.weighting = data.weighting;
        dto.votingBase = data.votingBase;
        dto.linkedFraction = data.linkedFraction;
        dto.finalized = p.finalized;
        dto.phase = lifecycle.phaseOf(p, timeSource.getTime());
        dto.voterCount = votes.votesOf(id).getVoters();
        return dto;
    }

    /**
     * Gets the proposals on the given page.
     *
     * @param page         The page.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the proposals on the page.
     */
    public synchronized Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        if (page < 0) {
            throw error(ErrorKind.INVALID_ARGUMENT, "getProposals", "Page number was negative");
        }
        if (itemsPerPage <= 0 || itemsPerPage > parameters.getInt(GovernanceParameters.MAX_PAGE_SIZE_KEY)) {
            throw error(ErrorKind.INVALID_ARGUMENT, "getProposals", "Invalid page size");
        }
        int[] pagination = Paginator.calcPagination(proposals.count(), page, itemsPerPage);
        List<ProposalDTO> list = new ArrayList<>();
        for (int i = pagination[0]; i < pagination[1]; i++) {
            list.add(getProposal(i));
        }
        return new Paginator.Paginated<>(page, pagination[2], list);
    }

    /**
     * Gets the number of proposals created on this engine.
     *
     * @return the number of proposals.
     */
    public synchronized int getProposalCount() {
        return proposals.count();
    }

    public synchronized ProposalPhase getPhase(int id) {
        return lifecycle.phaseOf(requireProposal(id, "getPhase"), timeSource.getTime());
    }

    public synchronized boolean hasVoted(int id, Hash160 voter) {
        requireProposal(id, "hasVoted");
        return votes.hasVoted(id, voter);
    }

    /**
     * @return the vote of {@code voter} on the proposal or null if the voter didn't vote.
     */
    public synchronized VoteRecord getVote(int id, Hash160 voter) {
        requireProposal(id, "getVote");
        return votes.get(id, voter);
    }

    /**
     * Gets the vote weight an option received. Binary proposals have the options {@code yes} and {@code no}.
     *
     * @param id     The proposal id.
     * @param option The option.
     * @return the vote weight of the option.
     */
    public synchronized long getVotes(int id, String option) {
        requireProposal(id, "getVotes");
        int slot = proposals.getData(id).slotOf(option);
        if (slot < 0) {
            throw error(ErrorKind.INVALID_OPTION, "getVotes", "Unknown option");
        }
        return countsOf(id)[slot];
    }

    /**
     * @return the vote weight of every option in declaration order.
     */
    public synchronized List<OptionResult> getResults(int id) {
        requireProposal(id, "getResults");
        return tally.results(proposals.getData(id), countsOf(id));
    }

    /**
     * Gets the yes and no counts of a binary proposal and whether they are final. Multi-option proposals report
     * zero yes and no votes; their counts are available from {@link #getResults(int)}.
     *
     * @param id The proposal id.
     * @return the voting history.
     */
    public synchronized VotingHistory getVotingHistory(int id) {
        Proposal p = requireProposal(id, "getVotingHistory");
        return history(p, proposals.getData(id));
    }

    /**
     * Applies {@code model} to the current votes of the proposal. Doesn't change any state.
     *
     * @param id    The proposal id.
     * @param model The decision rule.
     * @return the decision.
     */
    public synchronized Decision computeDecision(int id, GovernanceModel model) {
        requireProposal(id, "computeDecision");
        if (model == null) {
            throw error(ErrorKind.INVALID_ARGUMENT, "computeDecision", "No governance model");
        }
        return tally.decide(proposals.getData(id), countsOf(id), model);
    }

    public synchronized Fraction getFraction(int fractionId) {
        return requireFraction(fractionId, "getFraction");
    }

    public synchronized int getFractionCount() {
        return fractions.count();
    }

    /**
     * Decides the most recent vote on a fraction.
     *
     * @param fractionId The fraction.
     * @param model      The decision rule.
     * @return the decision.
     */
    public synchronized Decision calculateDecision(int fractionId, GovernanceModel model) {
        requireFraction(fractionId, "calculateDecision");
        int proposalId = fractions.latestVote(fractionId);
        if (proposalId == FractionRegistry.NO_VOTE) {
            throw error(ErrorKind.NOT_FOUND, "calculateDecision", "No vote on fraction");
        }
        return computeDecision(proposalId, model);
    }

    public synchronized long getLocked(Hash160 holder, int shareClass) {
        return locks.lockedOf(holder, shareClass);
    }

    /**
     * @return the lock of the holder or null if nothing is locked.
     */
    public synchronized LockRecord getLockRecord(Hash160 holder, int shareClass) {
        return locks.get(holder, shareClass);
    }

    /**
     * Gets the value of the parameter with {@code paramKey}.
     *
     * @param paramKey The parameter's key.
     * @return the parameter's value.
     */
    public synchronized int getParameter(String paramKey) {
        return parameters.getInt(paramKey);
    }

    /**
     * @return all parameters and their values.
     */
    public synchronized Map<String, Integer> getParameters() {
        return parameters.asMap();
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /**
     * @return the retained notifications, oldest first.
     */
    public List<Notification> getNotifications() {
        return bus.getNotifications();
    }

    public List<Notification> getNotifications(String eventName) {
        return bus.getNotifications(eventName);
    }

    public void addListener(EventListener listener) {
        bus.addListener(listener);
    }

    public void removeListener(EventListener listener) {
        bus.removeListener(listener);
    }

    //endregion SAFE METHODS

    //region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal.
     *
     * @param creator     The operator creating the proposal.
     * @param description The description.
     * @param options     The options of a multi-option proposal. Null or empty for a binary proposal.
     * @param deadline    The end of the voting window. Must be in the future.
     * @param votingBase  The denominator of decisions on this proposal.
     * @return the id of the proposal.
     */
    public int createProposal(Hash160 creator, String description, List<String> options, long deadline,
            long votingBase) {
        ProposalRequest request = new ProposalRequest(description, deadline).votingBase(votingBase);
        if (options != null) {
            request.options(options);
        }
        return createProposal(creator, request);
    }

    /**
     * Creates a proposal from a request.
     * <p>
     * If the request names a share class, only holders of that class can vote. If it doesn't give a voting base, the
     * total minted amount of the share class at this moment becomes the base.
     *
     * @param creator The operator creating the proposal.
     * @param request The proposal parameters.
     * @return the id of the proposal.
     */
    public int createProposal(Hash160 creator, ProposalRequest request) {
        try {
            synchronized (this) {
                abortIfPaused("createProposal");
                abortIfNotAuthorized(creator, "createProposal");
                return create(creator, request, ProposalData.NONE, "createProposal");
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Opens voting on a proposal. Votes are accepted from {@code votingStart} until the deadline, both inclusive.
     *
     * @param caller      The operator opening the vote.
     * @param id          The proposal id.
     * @param votingStart The start of the voting window. Must be positive and before the deadline.
     */
    public void openVoting(Hash160 caller, int id, long votingStart) {
        try {
            synchronized (this) {
                abortIfPaused("openVoting");
                abortIfNotAuthorized(caller, "openVoting");
                Proposal p = requireProposal(id, "openVoting");
                lifecycle.checkOpenable(p, votingStart, "openVoting");

                lifecycle.open(p, votingStart);
                log.info("Voting on proposal {} opens at {}", id, votingStart);
                votingStarted.fire(id, votingStart);
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Casts a yes or no vote on a binary proposal.
     * <p>
     * On proposals bound to a share class the voter's shares of that class are locked until the deadline has passed.
     * The summed weight of all votes never exceeds the proposal's voting base.
     *
     * @param id      The proposal id.
     * @param voter   The voter.
     * @param approve True for yes, false for no.
     */
    public void castVote(int id, Hash160 voter, boolean approve) {
        try {
            synchronized (this) {
                recordVote(id, voter, approve, approve ? ProposalData.YES : ProposalData.NO, true);
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Casts a vote for one of the declared options of a multi-option proposal.
     *
     * @param id     The proposal id.
     * @param voter  The voter.
     * @param option The chosen option.
     */
    public void castVote(int id, Hash160 voter, String option) {
        try {
            synchronized (this) {
                recordVote(id, voter, option, option, false);
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Finalizes a proposal after its deadline passed. Freezes the vote counts; no votes are accepted afterwards.
     *
     * @param caller The operator finalizing the proposal.
     * @param id     The proposal id.
     * @return the frozen voting history.
     */
    public VotingHistory finalizeProposal(Hash160 caller, int id) {
        try {
            synchronized (this) {
                abortIfPaused("finalize");
                abortIfNotAuthorized(caller, "finalize");
                Proposal p = requireProposal(id, "finalize");
                lifecycle.checkFinalizable(p, timeSource.getTime(), "finalize");

                lifecycle.markFinalized(p, votes.votesOf(id).getCounts());
                VotingHistory h = history(p, proposals.getData(id));
                log.info("Finalized proposal {} with yes={} no={}", id, h.getYes(), h.getNo());
                finalized.fire(id, h.getYes(), h.getNo());
                return h;
            }
        } finally {
            bus.deliverPending();
        }
    }

    //endregion GOVERNANCE PROCESS METHODS

    //region FRACTIONS

    /**
     * Registers a fractionalised asset and mints its shares to the owner. The fraction id is also the share class of
     * the shares.
     *
     * @param caller  The operator.
     * @param assetId The id of the asset.
     * @param owner   The receiver of the minted shares.
     * @param amount  The number of shares.
     * @return the fraction id.
     */
    public int createFraction(Hash160 caller, String assetId, Hash160 owner, long amount) {
        try {
            synchronized (this) {
                abortIfPaused("createFraction");
                abortIfNotAuthorized(caller, "createFraction");
                if (assetId == null || assetId.trim().isEmpty()) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "createFraction", "Missing asset id");
                }
                if (owner == null) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "createFraction", "Missing owner");
                }
                if (amount <= 0) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "createFraction", "Amount not positive");
                }

                ledger.mint(owner, fractions.count(), amount);
                Fraction f = fractions.add(assetId, owner, amount, timeSource.getTime());
                log.info("Created fraction {} of asset {} with {} shares", f.getId(), assetId, amount);
                fractionCreated.fire(f.getId(), assetId, amount);
                return f.getId();
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Creates a binary proposal on a fraction. Holders vote with their shares of the fraction and the minted amount
     * of the fraction is the voting base.
     *
     * @param caller      The operator.
     * @param fractionId  The fraction.
     * @param description The description.
     * @param deadline    The end of the voting window.
     * @return the id of the proposal.
     */
    public int createFractionVote(Hash160 caller, int fractionId, String description, long deadline) {
        try {
            synchronized (this) {
                abortIfPaused("createFractionVote");
                abortIfNotAuthorized(caller, "createFractionVote");
                Fraction f = requireFraction(fractionId, "createFractionVote");
                ProposalRequest request = new ProposalRequest(description, deadline)
                        .shareClass(f.getShareClass())
                        .weighting(VotingWeight.BALANCE)
                        .votingBase(f.getAmount());
                int id = create(caller, request, fractionId, "createFractionVote");
                fractions.linkVote(fractionId, id);
                return id;
            }
        } finally {
            bus.deliverPending();
        }
    }

    //endregion FRACTIONS

    //region LOCKED BALANCES

    /**
     * Moves shares of the holder into escrow until {@code unlockTime}.
     *
     * @param holder     The holder.
     * @param shareClass The share class.
     * @param amount     The amount. At most the holder's spendable balance.
     * @param unlockTime The earliest time the shares can be unlocked. Must be in the future.
     */
    public void lockTokens(Hash160 holder, int shareClass, long amount, long unlockTime) {
        try {
            synchronized (this) {
                abortIfPaused("lockTokens");
                if (holder == null) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "lockTokens", "Missing holder");
                }
                if (amount <= 0) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "lockTokens", "Amount not positive");
                }
                lifecycle.checkDeadline(unlockTime, timeSource.getTime(), "lockTokens");
                if (amount > ledger.balanceOf(holder, shareClass)) {
                    throw error(ErrorKind.INSUFFICIENT_BALANCE, "lockTokens");
                }

                ledger.lock(holder, shareClass, amount);
                locks.add(holder, shareClass, amount, unlockTime);
                log.info("Locked {} shares of class {} for {} until {}", amount, shareClass, holder, unlockTime);
                tokensLocked.fire(holder, shareClass, amount, unlockTime);
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Moves shares of the holder out of escrow back to the spendable balance.
     *
     * @param holder     The holder.
     * @param shareClass The share class.
     * @param amount     The amount. At most the locked amount.
     */
    public void unlockTokens(Hash160 holder, int shareClass, long amount) {
        try {
            synchronized (this) {
                abortIfPaused("unlockTokens");
                if (holder == null) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "unlockTokens", "Missing holder");
                }
                if (amount <= 0) {
                    throw error(ErrorKind.INVALID_ARGUMENT, "unlockTokens", "Amount not positive");
                }
                LockRecord lock = locks.get(holder, shareClass);
                if (lock == null || lock.getAmount() < amount) {
                    throw error(ErrorKind.INSUFFICIENT_LOCKED, "unlockTokens");
                }
                if (timeSource.getTime() < lock.getUnlockTime()) {
                    throw error(ErrorKind.TOO_EARLY, "unlockTokens", "Shares still locked");
                }

                ledger.unlock(holder, shareClass, amount);
                locks.release(holder, shareClass, amount);
                log.info("Unlocked {} shares of class {} for {}", amount, shareClass, holder);
                tokensUnlocked.fire(holder, shareClass, amount);
            }
        } finally {
            bus.deliverPending();
        }
    }

    //endregion LOCKED BALANCES

    //region ADMINISTRATION

    /**
     * Changes the value of the parameter with {@code paramKey} to {@code value}.
     *
     * @param caller   The operator.
     * @param paramKey The parameter's key.
     * @param value    The new parameter value.
     */
    public void changeParam(Hash160 caller, String paramKey, int value) {
        try {
            synchronized (this) {
                abortIfPaused("changeParam");
                abortIfNotAuthorized(caller, "changeParam");
                parameters.put(paramKey, value, "changeParam");
                if (GovernanceParameters.EVENT_HISTORY_KEY.equals(paramKey)) {
                    bus.setHistoryCapacity(value);
                }
                log.info("Parameter {} changed to {}", paramKey, value);
                paramChanged.fire(paramKey, value);
            }
        } finally {
            bus.deliverPending();
        }
    }

    /**
     * Stops all state-changing operations until {@link #unpause(Hash160)} is called.
     *
     * @param caller The operator.
     */
    public void pause(Hash160 caller) {
        try {
            synchronized (this) {
                abortIfNotAuthorized(caller, "pause");
                paused = true;
                log.info("Engine paused by {}", caller);
                pausedEvent.fire();
            }
        } finally {
            bus.deliverPending();
        }
    }

    public void unpause(Hash160 caller) {
        try {
            synchronized (this) {
                abortIfNotAuthorized(caller, "unpause");
                paused = false;
                log.info("Engine unpaused by {}", caller);
                unpausedEvent.fire();
            }
        } finally {
            bus.deliverPending();
        }
    }

    //endregion ADMINISTRATION

    private int create(Hash160 creator, ProposalRequest request, int linkedFraction, String method) {
        long now = timeSource.getTime();
        lifecycle.checkDeadline(request.getDeadline(), now, method);
        String description = request.getDescription();
        if (description == null || description.trim().isEmpty()) {
            throw error(ErrorKind.INVALID_PROPOSAL, method, "Missing description");
        }
        List<String> options = request.getOptions();
        throwOnInvalidOptions(options, method);
        if (request.getShareClass() == ProposalData.NONE && request.getWeighting() == VotingWeight.BALANCE) {
            throw error(ErrorKind.INVALID_PROPOSAL, method, "Balance weighting needs a share class");
        }
        long votingBase = request.getVotingBase();
        if (votingBase == 0 && request.getShareClass() != ProposalData.NONE) {
            votingBase = ledger.totalMinted(request.getShareClass());
        }
        if (votingBase <= 0) {
            throw error(ErrorKind.INVALID_PROPOSAL, method, "Voting base not positive");
        }

        ProposalData data = new ProposalData(creator, description, options, now, request.getShareClass(),
                request.getWeighting(), votingBase, linkedFraction);
        Proposal p = proposals.add(data, request.getDeadline());
        votes.register(p.id, data.slotCount());
        log.info("Created proposal {} '{}' with deadline {} and voting base {}", p.id, description,
                p.deadline, votingBase);
        created.fire(p.id, description, p.deadline);
        return p.id;
    }

    private void throwOnInvalidOptions(List<String> options, String method) {
        if (options.isEmpty()) {
            return;
        }
        if (options.size() < 2) {
            throw error(ErrorKind.INVALID_PROPOSAL, method, "Less than two options");
        }
        if (options.size() > parameters.getInt(GovernanceParameters.MAX_OPTIONS_KEY)) {
            throw error(ErrorKind.INVALID_PROPOSAL, method, "Too many options");
        }
        Set<String> seen = new HashSet<>();
        for (String o : options) {
            if (o == null || o.trim().isEmpty()) {
                throw error(ErrorKind.INVALID_PROPOSAL, method, "Blank option");
            }
            if (!seen.add(o)) {
                throw error(ErrorKind.INVALID_PROPOSAL, method, "Duplicate option");
            }
        }
    }

    private void recordVote(int id, Hash160 voter, Object choice, String option, boolean binaryChoice) {
        abortIfPaused("vote");
        if (voter == null) {
            throw error(ErrorKind.INVALID_ARGUMENT, "vote", "Missing voter");
        }
        Proposal p = requireProposal(id, "vote");
        long now = timeSource.getTime();
        lifecycle.checkVotingWindow(p, now, "vote");
        if (votes.hasVoted(id, voter)) {
            throw error(ErrorKind.ALREADY_VOTED, "vote");
        }
        ProposalData data = proposals.getData(id);
        long weight = 1;
        if (data.shareClass != ProposalData.NONE) {
            long holding = Math.addExact(ledger.balanceOf(voter, data.shareClass),
                    locks.lockedOf(voter, data.shareClass));
            if (holding <= 0) {
                throw error(ErrorKind.NO_VOTING_WEIGHT, "vote");
            }
            if (data.weighting == VotingWeight.BALANCE) {
                weight = holding;
            }
        }
        if (binaryChoice != data.isBinary()) {
            throw error(ErrorKind.INVALID_OPTION, "vote", "Choice doesn't match the proposal kind");
        }
        int slot = data.slotOf(option);
        if (slot < 0) {
            throw error(ErrorKind.INVALID_OPTION, "vote", "Unknown option");
        }
        if (weight > data.votingBase - votes.votesOf(id).getTotal()) {
            throw error(ErrorKind.NO_VOTING_WEIGHT, "vote", "Vote weight exceeds the voting base");
        }

        if (data.shareClass != ProposalData.NONE) {
            escrowUntilClosed(voter, data.shareClass, p);
        }
        votes.record(new VoteRecord(id, voter, choice, slot, weight, now));
        log.debug("Vote on proposal {} by {}: {} with weight {}", id, voter, choice, weight);
        voteCast.fire(id, voter, choice);
    }

    /**
     * Locks the voter's spendable shares of the class until the voting window of {@code p} has closed, so the shares
     * cannot be handed to another voter of the same proposal.
     */
    private void escrowUntilClosed(Hash160 voter, int shareClass, Proposal p) {
        long spendable = ledger.balanceOf(voter, shareClass);
        long unlockTime = p.deadline == Long.MAX_VALUE ? p.deadline : p.deadline + 1;
        if (spendable > 0) {
            ledger.lock(voter, shareClass, spendable);
            locks.add(voter, shareClass, spendable, unlockTime);
            tokensLocked.fire(voter, shareClass, spendable, unlockTime);
        } else if (locks.get(voter, shareClass) != null) {
            locks.add(voter, shareClass, 0, unlockTime);
        }
    }

    private VotingHistory history(Proposal p, ProposalData data) {
        long[] counts = p.finalized ? p.finalCounts : votes.votesOf(p.id).getCounts();
        if (!data.isBinary()) {
            return new VotingHistory(0, 0, p.finalized);
        }
        return new VotingHistory(counts[0], counts[1], p.finalized);
    }

    private long[] countsOf(int id) {
        Proposal p = proposals.get(id);
        if (p.finalized) {
            return p.finalCounts.clone();
        }
        ProposalVotes pv = votes.votesOf(id);
        return pv.getCounts();
    }

    private Proposal requireProposal(int id, String method) {
        Proposal p = proposals.get(id);
        if (p == null) {
            throw error(ErrorKind.NOT_FOUND, method, "Proposal doesn't exist");
        }
        return p;
    }

    private Fraction requireFraction(int fractionId, String method) {
        Fraction f = fractions.get(fractionId);
        if (f == null) {
            throw error(ErrorKind.NOT_FOUND, method, "Fraction doesn't exist");
        }
        return f;
    }

    private void abortIfNotAuthorized(Hash160 caller, String method) {
        if (caller == null || !accessControl.isAuthorized(caller)) {
            throw error(ErrorKind.NOT_AUTHORIZED, method);
        }
    }

    private void abortIfPaused(String method) {
        if (paused) {
            throw error(ErrorKind.PAUSED, method);
        }
    }

    private static GovernanceException error(ErrorKind kind, String method) {
        return error(kind, method, kind.getDefaultMessage());
    }

    private static GovernanceException error(ErrorKind kind, String method, String reason) {
        GovernanceException e = new GovernanceException(kind, method, reason);
        log.debug("Rejected: {}", e.getMessage());
        return e;
    }
}

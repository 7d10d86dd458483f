package com.axlabs.neo.sharesgov.fraction;

import io.neow3j.types.Hash160;

import java.util.HashMap;
import java.util.Map;

/**
 * Append-only registry of fractions and of the latest vote linked to each of them.
 */
public class FractionRegistry {

    public static final int NO_VOTE = -1;

    private final Map<Integer, Fraction> fractions = new HashMap<>(); // [int id: Fraction fraction]
    private final Map<Integer, Integer> latestVotes = new HashMap<>(); // [int fraction id: int proposal id]
    private int fractionCount = 0;

    public Fraction add(String assetId, Hash160 owner, long amount, long createdAt) {
        int id = fractionCount;
        Fraction fraction = new Fraction(id, assetId, owner, amount, createdAt);
        fractions.put(id, fraction);
        fractionCount = id + 1;
        return fraction;
    }

    /**
     * @return the fraction or null if it doesn't exist.
     */
    public Fraction get(int id) {
        return fractions.get(id);
    }

    public int count() {
        return fractionCount;
    }

    public void linkVote(int fractionId, int proposalId) {
        latestVotes.put(fractionId, proposalId);
    }

    /**
     * @return the id of the most recent proposal voting on the fraction or {@link #NO_VOTE}.
     */
    public int latestVote(int fractionId) {
        return latestVotes.getOrDefault(fractionId, NO_VOTE);
    }
}
